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
package se.devrandom.sfbulk.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Component
public class WebClientConfig {
    @Bean
    public WebClient webClient(@Value("${sfbulk.http.connect-timeout-ms:30000}") int connectTimeoutMs,
                               @Value("${sfbulk.http.response-timeout:5m}") Duration responseTimeout,
                               @Value("${sfbulk.http.max-in-memory:64MB}") DataSize maxInMemory) {
        int maxInMemoryBytes = maxInMemoryBytes(maxInMemory);
        long ioTimeoutSeconds = responseTimeout.toSeconds();
        // Timeouts keep a dead connection from hanging a poll loop forever
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(responseTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ioTimeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(ioTimeoutSeconds, TimeUnit.SECONDS)));

        // Query result segments can be large, all of them are buffered in memory
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder().codecs(
                                clientCodecConfigurer ->
                                        clientCodecConfigurer.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                        .build())
                .build();
    }

    static int maxInMemoryBytes(DataSize size) {
        if (size.isNegative() || size.toBytes() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("sfbulk.http.max-in-memory must be between 0 and 2GB, was " + size);
        }
        return (int) size.toBytes();
    }
}
