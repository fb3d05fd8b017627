package dev.devanks.mediagen.orchestrator.client;

import com.google.common.annotations.VisibleForTesting;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Raw byte transfers that do not go through the Haiyi API itself: PUTs to presigned storage URLs and
 * downloads of generated media from CDN links.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MediaTransferClient {

    // browser headers the storage CORS policy checks on a presigned PUT
    private static final List<String> FORWARDED_HEADERS = List.of(
            HttpHeaders.USER_AGENT, HttpHeaders.ORIGIN, HttpHeaders.REFERER);

    private final WebClient webClient;

    /**
     * @param browserHeaders the platform headers of the session; user-agent, origin and referer are forwarded
     */
    public void upload(URI presignedUrl, byte[] bytes, String contentType, Map<String, String> browserHeaders,
                       Duration timeout) {
        log.debug("PUT {} bytes ({}) to presigned URL host {}", bytes.length, contentType, presignedUrl.getHost());
        put(presignedUrl, bytes, contentType, browserHeaders)
                .timeout(timeout)
                .block();
    }

    public byte[] download(URI url, String userAgent, Duration timeout) {
        log.debug("Downloading {}", url);
        byte[] body = fetch(url, userAgent)
                .timeout(timeout)
                .block();
        return body != null ? body : new byte[0];
    }

    @VisibleForTesting
    Mono<Void> put(URI presignedUrl, byte[] bytes, String contentType, Map<String, String> browserHeaders) {
        return webClient.put()
                .uri(presignedUrl)
                .contentType(MediaType.parseMediaType(contentType))
                .header(HttpHeaders.ACCEPT, "*/*")
                .headers(headers -> browserHeaders.forEach((name, value) -> {
                    if (value != null && FORWARDED_HEADERS.stream().anyMatch(name::equalsIgnoreCase)) {
                        headers.set(name, value);
                    }
                }))
                .bodyValue(bytes)
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    @VisibleForTesting
    Mono<byte[]> fetch(URI url, String userAgent) {
        return webClient.get()
                .uri(url)
                .header(HttpHeaders.USER_AGENT, userAgent)
                .retrieve()
                .bodyToMono(byte[].class);
    }
}
