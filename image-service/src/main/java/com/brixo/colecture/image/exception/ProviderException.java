package com.brixo.colecture.image.exception;

/**
 * Error de un proveedor externo (búsqueda, scoring, chequeo de seguridad) que responde
 * con un estado de fallo. Se absorbe en el punto de integración y nunca llega al cliente.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final boolean quotaExceeded;

    public ProviderException(String provider, String message, boolean quotaExceeded) {
        super(provider + ": " + message);
        this.provider = provider;
        this.quotaExceeded = quotaExceeded;
    }

    public String getProvider() {
        return provider;
    }

    /** True si el proveedor indica cuota o límite de uso agotado. */
    public boolean isQuotaExceeded() {
        return quotaExceeded;
    }
}
