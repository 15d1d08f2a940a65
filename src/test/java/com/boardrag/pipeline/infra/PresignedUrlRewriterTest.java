package com.boardrag.pipeline.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;

class PresignedUrlRewriterTest {

    private static final String SIGNED = "http://minio:9000/documents/abc.pdf"
        + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Credential=minioadmin%2F20260101%2Fus-east-1%2Fs3%2Faws4_request"
        + "&X-Amz-Signature=deadbeef";

    @Test
    @DisplayName("Should move the URL to the public host and keep the signed query byte for byte")
    void shouldRewriteHostAndKeepQuery() throws MalformedURLException {
        PresignedUrlRewriter rewriter = new PresignedUrlRewriter("https://files.example.org");

        String rewritten = rewriter.rewrite(url(SIGNED));

        assertThat(rewritten).startsWith("https://files.example.org/documents/abc.pdf?");
        assertThat(rewritten).contains("X-Amz-Credential=minioadmin%2F20260101%2Fus-east-1%2Fs3%2Faws4_request");
        assertThat(rewritten).endsWith("X-Amz-Signature=deadbeef");
    }

    @Test
    @DisplayName("Should prefix the path of a public endpoint mounted under a sub path")
    void shouldPrefixPublicPath() throws MalformedURLException {
        PresignedUrlRewriter rewriter = new PresignedUrlRewriter("http://localhost:8080/storage/");

        String rewritten = rewriter.rewrite(url(SIGNED));

        assertThat(rewritten).startsWith("http://localhost:8080/storage/documents/abc.pdf?");
    }

    @Test
    @DisplayName("Should leave the URL untouched without a public endpoint")
    void shouldKeepUrlWithoutPublicEndpoint() throws MalformedURLException {
        assertThat(new PresignedUrlRewriter("").rewrite(url(SIGNED))).isEqualTo(SIGNED);
        assertThat(new PresignedUrlRewriter("http://minio:9000").rewrite(url(SIGNED))).isEqualTo(SIGNED);
    }

    @Test
    @DisplayName("Should accept a public endpoint given without scheme")
    void shouldAcceptEndpointWithoutScheme() throws MalformedURLException {
        String rewritten = new PresignedUrlRewriter("cdn.example.org:9443").rewrite(url(SIGNED));

        assertThat(rewritten).startsWith("http://cdn.example.org:9443/documents/abc.pdf?");
    }

    private static URL url(String value) throws MalformedURLException {
        return URI.create(value).toURL();
    }
}
