package com.tony.gameFeatures.config;

import com.tony.gameFeatures.service.ScalingMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "features")
@Validated
@Data
public class FeatureProperties {

    // --- Fenêtres glissantes ---
    @Min(1)
    private int windowSize = 10;      // forme + split dom/ext

    @Min(1)
    private int h2hWindowSize = 10;   // confrontations directes

    // Matchs minimum de chaque côté avant d'émettre une ligne (évite le bruit de démarrage)
    @Min(0)
    private int minHistoryGames = 5;

    private boolean includeOutcome = true;

    // Calcul parallèle des lignes (l'ordre de sortie reste chronologique)
    private boolean parallel = false;

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Pipeline {
        // Fichier CSV des matchs ; si absent, le job ne fait rien
        private String input;

        @NotBlank
        private String outputDir = "data/processed";

        @NotBlank
        private String datasetName = "game_predictions";

        @NotBlank
        private String version = "v1";

        @NotBlank
        private String target = "home_win";

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double trainRatio = 0.7;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double valRatio = 0.15;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double testRatio = 0.15;

        @NotNull
        private ScalingMethod scaling = ScalingMethod.STANDARD;
    }
}
