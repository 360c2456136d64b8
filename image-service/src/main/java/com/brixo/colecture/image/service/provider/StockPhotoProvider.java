package com.brixo.colecture.image.service.provider;

import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.model.StockProvider;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Proveedor de búsqueda de fotos stock.
 */
public interface StockPhotoProvider {

    StockProvider provider();

    /** False si faltan credenciales: el buscador no lo consulta. */
    boolean isConfigured();

    /**
     * @param query       texto de búsqueda
     * @param perPage     número máximo de resultados
     * @param orientation {@code landscape}, {@code portrait}, {@code square} o null
     */
    Mono<List<StockCandidate>> search(String query, int perPage, String orientation);
}
