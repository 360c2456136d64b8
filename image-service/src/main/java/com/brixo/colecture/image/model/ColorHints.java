package com.brixo.colecture.image.model;

/**
 * Colores corporativos opcionales que se incrustan en el prompt de generación.
 *
 * @param primary   color primario (hex o nombre), puede ser null
 * @param secondary color secundario, puede ser null
 */
public record ColorHints(String primary, String secondary) {

    public boolean isEmpty() {
        return isBlank(primary) && isBlank(secondary);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
