package com.project.image.hairremoval;

import com.project.image.hairremoval.DTOs.HairRemovalOptions;
import com.project.image.hairremoval.DTOs.InpaintingMode;
import com.project.image.hairremoval.DTOs.ThresholdMode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.hair-removal.threshold-mode=ADAPTIVE",
        "app.hair-removal.adaptive-block-size=51",
        "app.hair-removal.inpainting-mode=SINGLE_FAST",
        "app.hair-removal.working-width=512"
})
class PipelineConfigTest {

    @Autowired HairRemovalOptions options;

    @Test
    void options_areBoundFromProperties() {
        assertThat(options.thresholdMode()).isEqualTo(ThresholdMode.ADAPTIVE);
        assertThat(options.adaptiveBlockSize()).isEqualTo(51);
        assertThat(options.inpaintingMode()).isEqualTo(InpaintingMode.SINGLE_FAST);
        assertThat(options.workingWidth()).isEqualTo(512);
        assertThat(options.workingHeight()).isEqualTo(720);
        assertThat(options.topHatRadius()).isEqualTo(18);
    }
}
