package com.boardrag.pipeline.infra;

import com.boardrag.pipeline.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Points presigned URLs at the externally reachable storage endpoint. Path and query are carried over
 * in their already encoded form so signature parameters are never encoded twice.
 */
@Slf4j
@Component
public class PresignedUrlRewriter {

    private final URI publicEndpoint;

    public PresignedUrlRewriter(StorageProperties properties) {
        this(properties.publicEndpoint());
    }

    PresignedUrlRewriter(String publicEndpoint) {
        this.publicEndpoint = parse(publicEndpoint);
    }

    public String rewrite(URL presigned) {
        URI source;
        try {
            source = presigned.toURI();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Presigned URL is not a valid URI: " + presigned, e);
        }

        if (publicEndpoint == null || sameAuthority(source, publicEndpoint)) {
            return source.toString();
        }

        String prefix = publicEndpoint.getRawPath() == null ? "" : stripTrailingSlash(publicEndpoint.getRawPath());

        String rewritten = UriComponentsBuilder.fromUri(source)
            .scheme(publicEndpoint.getScheme())
            .host(publicEndpoint.getHost())
            .port(publicEndpoint.getPort())
            .replacePath(prefix + source.getRawPath())
            .build(true)
            .toUriString();

        log.debug("Rewrote presigned URL host {} to {}", source.getHost(), publicEndpoint.getHost());
        return rewritten;
    }

    private static boolean sameAuthority(URI source, URI target) {
        return source.getHost() != null
            && source.getHost().equalsIgnoreCase(target.getHost())
            && source.getPort() == target.getPort()
            && source.getScheme().equalsIgnoreCase(target.getScheme());
    }

    private static URI parse(String endpoint) {
        if (!StringUtils.hasText(endpoint)) {
            return null;
        }
        String value = endpoint.contains("://") ? endpoint : "http://" + endpoint;
        return URI.create(value);
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
