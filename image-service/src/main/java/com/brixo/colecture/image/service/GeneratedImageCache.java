package com.brixo.colecture.image.service;

import com.brixo.colecture.image.model.CachedImage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Almacén en memoria de imágenes generadas que llegan en línea (bytes o data URL),
 * servidas después por {@code GET /generated/{id}}.
 *
 * Las entradas nunca se modifican: cada {@code store} inserta con put-if-absent y un
 * id ya ocupado por otro contenido se regenera. Tamaño máximo y TTL acotan la memoria.
 */
public class GeneratedImageCache {

    private static final Logger log = LoggerFactory.getLogger(GeneratedImageCache.class);

    private static final String DEFAULT_MEDIA_TYPE = "application/octet-stream";
    private static final int MAX_ID_ATTEMPTS = 5;

    private final ImageIdGenerator idGenerator;
    private final Clock clock;
    private final Cache<String, CachedImage> store;

    public GeneratedImageCache(ImageIdGenerator idGenerator, long maximumEntries,
            Duration expireAfterWrite, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.store = Caffeine.newBuilder()
                .maximumSize(maximumEntries)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    /**
     * Guarda bytes y devuelve su id.
     *
     * @param data      bytes de la imagen
     * @param mediaType tipo MIME; null equivale a {@code application/octet-stream}
     */
    public String store(byte[] data, String mediaType) {
        String type = mediaType != null && !mediaType.isBlank() ? mediaType : DEFAULT_MEDIA_TYPE;
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String id = idGenerator.nextId(data);
            CachedImage entry = new CachedImage(id, data, type, clock.instant());
            CachedImage existing = store.asMap().putIfAbsent(id, entry);
            if (existing == null) {
                log.debug("Imagen generada cacheada: id={} ({} bytes, {})", id, data.length, type);
                return id;
            }
            if (Arrays.equals(existing.data(), data)) {
                // Mismo contenido con id derivado del contenido
                return id;
            }
            log.warn("Colisión de id {} en caché de imágenes (intento {})", id, attempt);
        }
        throw new IllegalStateException("No se pudo asignar un id libre tras " + MAX_ID_ATTEMPTS + " intentos");
    }

    /**
     * Decodifica una data URL ({@code data:image/png;base64,...}) y la guarda.
     *
     * @throws IllegalArgumentException si no es una data URL válida
     */
    public String storeDataUrl(String dataUrl) {
        if (dataUrl == null || !dataUrl.startsWith("data:")) {
            throw new IllegalArgumentException("No es una data URL");
        }
        int comma = dataUrl.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("Formato de data URL inválido");
        }
        String header = dataUrl.substring("data:".length(), comma);
        String payload = dataUrl.substring(comma + 1);

        String mediaType = header.contains(";") ? header.substring(0, header.indexOf(';')) : header;
        boolean base64 = Arrays.asList(header.split(";")).contains("base64");

        byte[] data;
        try {
            data = base64
                    ? Base64.getMimeDecoder().decode(payload)
                    : percentDecode(payload);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Contenido inválido en data URL: " + e.getMessage(), e);
        }
        return store(data, mediaType.isBlank() ? null : mediaType);
    }

    /**
     * Decodifica {@code %XX} a bytes; el resto de caracteres (incluido {@code +}) se copia tal cual.
     */
    static byte[] percentDecode(String payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length());
        int i = 0;
        while (i < payload.length()) {
            int cp = payload.codePointAt(i);
            if (cp == '%') {
                int high = i + 1 < payload.length() ? Character.digit(payload.charAt(i + 1), 16) : -1;
                int low = i + 2 < payload.length() ? Character.digit(payload.charAt(i + 2), 16) : -1;
                if (high < 0 || low < 0) {
                    throw new IllegalArgumentException("Escape % inválido en la posición " + i);
                }
                out.write((high << 4) | low);
                i += 3;
            } else {
                byte[] raw = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
                out.write(raw, 0, raw.length);
                i += Character.charCount(cp);
            }
        }
        return out.toByteArray();
    }

    public Optional<CachedImage> retrieve(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.getIfPresent(id));
    }

    /** Número aproximado de entradas vivas. */
    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }
}
