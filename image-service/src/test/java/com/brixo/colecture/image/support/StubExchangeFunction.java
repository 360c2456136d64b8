package com.brixo.colecture.image.support;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ExchangeFunction} de pruebas: responde en orden con respuestas JSON
 * preparadas (la última se repite) y registra las peticiones recibidas.
 */
public class StubExchangeFunction implements ExchangeFunction {

    private final Deque<Prepared> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private Prepared last;

    public static StubExchangeFunction json(String... bodies) {
        StubExchangeFunction stub = new StubExchangeFunction();
        for (String body : bodies) {
            stub.thenRespond(HttpStatus.OK, body);
        }
        return stub;
    }

    public StubExchangeFunction thenRespond(HttpStatus status, String body) {
        responses.add(new Prepared(status, body));
        return this;
    }

    @Override
    public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        if (!responses.isEmpty()) {
            last = responses.poll();
        }
        if (last == null) {
            return Mono.error(new IllegalStateException("Sin respuesta preparada para " + request.url()));
        }
        return Mono.just(ClientResponse.create(last.status())
                .header("Content-Type", "application/json")
                .body(last.body())
                .build());
    }

    public WebClient webClient() {
        return WebClient.builder()
                .baseUrl("http://stub.local")
                .exchangeFunction(this)
                .build();
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    public ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private record Prepared(HttpStatus status, String body) {
    }
}
