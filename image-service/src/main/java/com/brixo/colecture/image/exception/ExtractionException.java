package com.brixo.colecture.image.exception;

/**
 * Se lanza cuando la llamada al LLM de extracción de keywords falla o su respuesta
 * no se puede interpretar. Sin intención no hay resultado posible: la API responde 502.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
