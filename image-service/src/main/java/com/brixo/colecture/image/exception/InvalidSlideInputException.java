package com.brixo.colecture.image.exception;

/**
 * Petición mal formada (sin título ni keywords, parámetros desconocidos). Respuesta 400.
 */
public class InvalidSlideInputException extends RuntimeException {

    public InvalidSlideInputException(String message) {
        super(message);
    }

    public InvalidSlideInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
