package me.golemcore.reports.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Tests enqueue responses (or
 * failures), and every request URL is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> capturedRequests = new ConcurrentLinkedQueue<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .build();
    }

    public void enqueueBytes(int code, byte[] body, String contentType) {
        plannedResults.add(new PlannedResult(code, body != null ? body : new byte[0], contentType, null));
    }

    public void enqueueText(int code, String body) {
        enqueueBytes(code, body != null ? body.getBytes(StandardCharsets.UTF_8) : null, "text/plain");
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(new PlannedResult(0, new byte[0], null, failure));
    }

    public Request takeRequest() {
        return capturedRequests.poll();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(request);

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        MediaType mediaType = plannedResult.contentType() != null
                ? MediaType.parse(plannedResult.contentType())
                : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .body(ResponseBody.create(plannedResult.body(), mediaType))
                .build();
    }

    private record PlannedResult(int code, byte[] body, String contentType, IOException failure) {
    }
}
