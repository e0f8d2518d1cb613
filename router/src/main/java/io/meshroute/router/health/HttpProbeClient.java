package io.meshroute.router.health;

import io.meshroute.core.model.ServiceInstance;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Probes {@code GET {instance url}{healthPath}} with reactor-netty.
 */
public class HttpProbeClient implements ProbeClient {
    private static final Logger log = LoggerFactory.getLogger(HttpProbeClient.class);

    private final HttpClient httpClient;
    private final String healthPath;

    public HttpProbeClient(String healthPath) {
        this.healthPath = healthPath.startsWith("/") ? healthPath : "/" + healthPath;
        this.httpClient = HttpClient.create()
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON));
        log.info("HttpProbeClient initialized with path {}", this.healthPath);
    }

    @Override
    public Mono<Integer> probe(ServiceInstance instance, Duration timeout) {
        String uri = instance.url() + healthPath;
        return httpClient
                .responseTimeout(timeout)
                .get()
                .uri(uri)
                .responseSingle((response, body) -> body.asString()
                        .defaultIfEmpty("")
                        .map(ignored -> response.status().code()))
                .doOnError(err -> log.debug("Probe {} failed: {}", uri, err.toString()));
    }
}
