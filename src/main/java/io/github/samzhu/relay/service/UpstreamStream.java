package io.github.samzhu.relay.service;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

import org.springframework.http.client.ClientHttpResponse;

/**
 * 已開啟的上游串流回應
 *
 * <p>由 {@link GeminiUpstreamClient#openStream} 回傳，呼叫端讀完後必須關閉。
 */
public class UpstreamStream implements Closeable {

    private final ClientHttpResponse response;

    public UpstreamStream(ClientHttpResponse response) {
        this.response = response;
    }

    public InputStream getBody() throws IOException {
        return response.getBody();
    }

    @Override
    public void close() {
        response.close();
    }
}
