package com.corpusindex.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Response;

/**
 * Runs an OkHttp call with a whole-call timeout while keeping the caller interruptible. An interrupt
 * cancels the underlying call instead of leaving it running in the dispatcher.
 */
public final class HttpCalls {
    private HttpCalls() {
    }

    public static Response await(Call call, Duration timeout) throws IOException, InterruptedException {
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture<Response> pending = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                pending.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                if (!pending.complete(response)) {
                    response.close();
                }
            }
        });
        try {
            return pending.get();
        } catch (InterruptedException e) {
            call.cancel();
            pending.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("HTTP call failed: " + call.request().url(), cause);
        }
    }

    public static boolean isRetryableStatus(int code) {
        return code == 408 || code == 429 || code >= 500;
    }
}
