package com.brixo.colecture.image;

import com.brixo.colecture.image.config.ScoringThresholds;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.service.ImageOrchestrator;
import com.brixo.colecture.image.service.generation.ModelRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.SpringBootTest.WebEnvironment;
import org.springframework.test.context.TestPropertySource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifica que el contexto arranca sin credenciales reales y con la configuración por defecto.
 */
@SpringBootTest(webEnvironment = WebEnvironment.MOCK)
@TestPropertySource(properties = {
        "colecture.openrouter.api-key=test-key",
        "colecture.scoring.min-quality-score=0.5"
})
class ImageServiceApplicationTests {

    @Autowired
    private ImageOrchestrator orchestrator;

    @Autowired
    private ModelRouter modelRouter;

    @Autowired
    private ScoringThresholds thresholds;

    @Test
    void contextLoads() {
        assertNotNull(orchestrator);
        assertEquals(ImageModel.FLUX, modelRouter.route(Optional.empty(), null));
        assertEquals(ImageModel.IMAGEN, modelRouter.safeFallback());
        assertEquals(0.5, thresholds.minQualityScore());
        assertEquals(0.99, thresholds.minNuditySafeScore());
    }
}
