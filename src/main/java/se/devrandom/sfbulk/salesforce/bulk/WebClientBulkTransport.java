/*
 * SF Bulk - Salesforce Bulk API job orchestrator
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.sfbulk.salesforce.bulk;

import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link BulkTransport} on top of the shared {@link WebClient}. Calls block until the
 * response body has been read.
 */
public class WebClientBulkTransport implements BulkTransport {
    private final WebClient webClient;

    public WebClientBulkTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public BulkResponse get(String url, Map<String, String> headers) {
        return webClient
                .get()
                .uri(URI.create(url))
                .headers(httpHeaders -> copyHeaders(headers, httpHeaders))
                .exchangeToMono(WebClientBulkTransport::toBulkResponse)
                .block();
    }

    @Override
    public BulkResponse post(String url, Map<String, String> headers, String body) {
        return webClient
                .post()
                .uri(URI.create(url))
                .headers(httpHeaders -> copyHeaders(headers, httpHeaders))
                .bodyValue(body.getBytes(StandardCharsets.UTF_8))
                .exchangeToMono(WebClientBulkTransport::toBulkResponse)
                .block();
    }

    private static void copyHeaders(Map<String, String> headers, HttpHeaders httpHeaders) {
        headers.forEach(httpHeaders::set);
    }

    private static Mono<BulkResponse> toBulkResponse(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new BulkResponse(status, body));
    }
}
