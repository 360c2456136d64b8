package com.brixo.colecture.image.model;

/**
 * Proveedores de fotos stock. El orden de declaración es el orden de consulta y
 * la prioridad de desempate al ordenar candidatas.
 */
public enum StockProvider {

    UNSPLASH("unsplash", ImageSource.STOCK_UNSPLASH),
    PEXELS("pexels", ImageSource.STOCK_PEXELS);

    private final String id;
    private final ImageSource source;

    StockProvider(String id, ImageSource source) {
        this.id = id;
        this.source = source;
    }

    public String id() {
        return id;
    }

    public ImageSource source() {
        return source;
    }

    public int priority() {
        return ordinal();
    }
}
