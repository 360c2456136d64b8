package com.brixo.colecture.image.service;

import com.brixo.colecture.image.exception.ProviderException;
import com.brixo.colecture.image.model.CachedImage;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.service.provider.SightengineClient;
import com.brixo.colecture.image.service.provider.SightengineClient.Assessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SafetyCheckerTest {

    private SightengineClient sightengine;
    private SafetyChecker checker;

    @BeforeEach
    void setUp() {
        sightengine = mock(SightengineClient.class);
        checker = new SafetyChecker(sightengine, Duration.ofMillis(200));
    }

    @Test
    void hostedImageIsCheckedByUrl() {
        when(sightengine.checkNudity("https://cdn/flux.png")).thenReturn(Mono.just(new Assessment(null, 0.999)));

        assertEquals(Optional.of(0.999), checker.check(ImageModel.FLUX, "https://cdn/flux.png"));
    }

    @Test
    void cachedImageIsUploadedAsBytes() {
        CachedImage image = new CachedImage("abc", new byte[] { 1, 2 }, "image/png", Instant.now());
        when(sightengine.checkNudity(any(byte[].class), eq("image/png")))
                .thenReturn(Mono.just(new Assessment(null, 0.4)));

        assertEquals(Optional.of(0.4), checker.check(ImageModel.GEMINI, image));
        verify(sightengine, never()).checkNudity(anyString());
    }

    @Test
    void quotaErrorsTimeoutsAndMissingScoresSkipTheCheck() {
        when(sightengine.checkNudity("https://cdn/quota.png"))
                .thenReturn(Mono.error(new ProviderException("sightengine", "limit", true)));
        when(sightengine.checkNudity("https://cdn/slow.png")).thenReturn(Mono.never());
        when(sightengine.checkNudity("https://cdn/empty.png")).thenReturn(Mono.just(new Assessment(null, null)));

        assertTrue(checker.check(ImageModel.FLUX, "https://cdn/quota.png").isEmpty());
        assertTrue(checker.check(ImageModel.FLUX, "https://cdn/slow.png").isEmpty());
        assertTrue(checker.check(ImageModel.FLUX, "https://cdn/empty.png").isEmpty());
    }
}
