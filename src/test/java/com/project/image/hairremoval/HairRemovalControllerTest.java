package com.project.image.hairremoval;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class HairRemovalControllerTest {

    @Autowired MockMvc mvc;

    private static byte[] hairyPng() throws Exception {
        BufferedImage img = new BufferedImage(160, 120, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(205, 160, 140)); g.fillRect(0, 0, 160, 120);
        g.setColor(new Color(45, 30, 20)); g.fillRect(10, 58, 140, 3);
        g.dispose();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", out);
            return out.toByteArray();
        }
    }

    @Test
    void home_isServed() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"));
    }

    @Test
    void form_showsDefaultOptions() throws Exception {
        mvc.perform(get("/remove"))
                .andExpect(status().isOk())
                .andExpect(view().name("remove"))
                .andExpect(model().attributeExists("options", "supportedFormats"));
    }

    @Test
    void upload_flow_works() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "lesion.png", "image/png", hairyPng());

        mvc.perform(multipart("/remove")
                        .file(img)
                        .param("inpaintingMode", "SINGLE_FAST")
                        .param("preserveDetails", "false"))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attributeExists("hairFreeImage", "maskImage", "initialCoverage",
                        "finalCoverage", "hairPixels", "psnr"))
                .andExpect(model().attribute("downloadImage", startsWith("data:image/jpeg;base64,")))
                .andExpect(model().attribute("width", 720));
    }

    @Test
    void upload_rejectsNonImageContentType() throws Exception {
        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());

        mvc.perform(multipart("/remove").file(notImage))
                .andExpect(status().isOk())
                .andExpect(view().name("remove"))
                .andExpect(model().attributeExists("error"));
    }

    @Test
    void upload_rejectsCorruptImage() throws Exception {
        MockMultipartFile corrupt = new MockMultipartFile(
                "file", "a.png", "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        mvc.perform(multipart("/remove").file(corrupt))
                .andExpect(status().isOk())
                .andExpect(view().name("remove"))
                .andExpect(model().attribute("error", startsWith("The file is not a valid image")));
    }
}
