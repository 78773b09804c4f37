package io.wxpanel.infrastructure.http;

import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Executes a GET and maps every failure to {@link FetchFailedException}.
 */
final class HttpCalls {
  private HttpCalls() {
    // Utility
  }

  static byte[] get(OkHttpClient client, String url) throws FetchFailedException, InterruptedException {
    Request request;
    try {
      request = new Request.Builder().url(url).get().build();
    } catch (IllegalArgumentException ex) {
      throw new FetchFailedException(url, "invalid URL " + url, ex);
    }
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful()) {
        String excerpt = body == null ? "" : Logs.excerpt(body.string());
        throw new FetchFailedException(url,
            "HTTP " + response.code() + " from " + url + (excerpt.isEmpty() ? "" : ": " + excerpt));
      }
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      if (bytes.length == 0) {
        throw new FetchFailedException(url, "empty response from " + url);
      }
      return bytes;
    } catch (SocketTimeoutException ex) {
      throw new FetchFailedException(url, "timed out fetching " + url, ex);
    } catch (InterruptedIOException ex) {
      if (Thread.currentThread().isInterrupted()) {
        InterruptedException interrupted = new InterruptedException("interrupted fetching " + url);
        interrupted.initCause(ex);
        throw interrupted;
      }
      throw new FetchFailedException(url, "timed out fetching " + url, ex);
    } catch (IOException ex) {
      throw new FetchFailedException(url, "request to " + url + " failed: " + ex.getMessage(), ex);
    }
  }
}
