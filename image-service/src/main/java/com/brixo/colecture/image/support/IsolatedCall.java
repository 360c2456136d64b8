package com.brixo.colecture.image.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Sub-llamada aislada: se ejecuta con su propio timeout y cualquier fallo
 * (excepción síncrona, error reactivo o timeout) se convierte en "ausente".
 *
 * Todos los puntos de integración tolerantes a fallos del pipeline (proveedores stock,
 * scoring, chequeo de seguridad, refinado de keywords) pasan por aquí.
 */
public final class IsolatedCall {

    private static final Logger log = LoggerFactory.getLogger(IsolatedCall.class);

    private IsolatedCall() {
    }

    /**
     * Envuelve una llamada reactiva. El {@code Mono} resultante nunca emite error:
     * completa vacío si la llamada falla o supera {@code timeout}.
     *
     * @param label   nombre de la llamada para los logs
     * @param call    proveedor del {@code Mono}; se evalúa de forma diferida
     * @param timeout presupuesto de esta llamada
     */
    public static <T> Mono<T> isolate(String label, Supplier<Mono<T>> call, Duration timeout) {
        return Mono.defer(call)
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("{} omitido: {}", label, describe(e));
                    return Mono.empty();
                });
    }

    /**
     * Variante bloqueante de {@link #isolate(String, Supplier, Duration)}.
     */
    public static <T> Optional<T> await(String label, Supplier<Mono<T>> call, Duration timeout) {
        return isolate(label, call, timeout).blockOptional();
    }

    /**
     * Ejecuta código bloqueante en {@code boundedElastic} con las mismas garantías.
     */
    public static <T> Optional<T> awaitBlocking(String label, Callable<T> call, Duration timeout) {
        return await(label,
                () -> Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic()),
                timeout);
    }

    static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        String message = e.getMessage();
        return message != null ? e.getClass().getSimpleName() + ": " + message
                : e.getClass().getSimpleName();
    }
}
