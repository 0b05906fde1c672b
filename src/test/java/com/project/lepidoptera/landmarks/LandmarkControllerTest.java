package com.project.lepidoptera.landmarks;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.hamcrest.Matchers.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "app.upload.dir=target/test-uploads")
class LandmarkControllerTest {

    @Autowired MockMvc mvc;

    private static MockMultipartFile specimen() throws Exception {
        return new MockMultipartFile("file", "specimen.png", "image/png",
                SpecimenFixtures.png(SpecimenFixtures.specimenPicture()));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void landmarks_flow_works() throws Exception {
        mvc.perform(multipart("/landmarks")
                        .file(specimen())
                        .param("topRuler", String.valueOf(SpecimenFixtures.TOP_RULER))
                        .with(csrf())
                        .contentType(MediaType.MULTIPART_FORM_DATA))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attribute("width", 91))
                .andExpect(model().attribute("height", 80))
                .andExpect(model().attribute("midline", 41))
                .andExpect(model().attribute("landmarks", hasSize(5)))
                .andExpect(model().attribute("overlayPath", startsWith("/uploads/")))
                .andExpect(model().attributeExists("originalPath"));
    }

    @Test
    @WithMockUser
    void storedOverlay_isServedUnderUploads() throws Exception {
        var result = mvc.perform(multipart("/landmarks")
                        .file(specimen())
                        .param("topRuler", String.valueOf(SpecimenFixtures.TOP_RULER))
                        .with(csrf()))
                .andExpect(view().name("result"))
                .andReturn();
        String overlayPath = (String) result.getModelAndView().getModel().get("overlayPath");

        mvc.perform(get(overlayPath))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG));
    }

    @Test
    @WithMockUser
    void landmarks_uniformPicture_showsFormWithError() throws Exception {
        BufferedImage blank = new BufferedImage(60, 60, BufferedImage.TYPE_INT_RGB);
        var g = blank.createGraphics();
        g.setColor(Color.DARK_GRAY);
        g.fillRect(0, 0, 60, 60);
        g.dispose();
        MockMultipartFile file = new MockMultipartFile("file", "blank.png", "image/png", SpecimenFixtures.png(blank));

        mvc.perform(multipart("/landmarks").file(file).param("topRuler", "40").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("landmarks"))
                .andExpect(model().attributeExists("error", "suggestion"));
    }

    @Test
    @WithMockUser
    void landmarks_rulerBelowPicture_showsFormWithFormats() throws Exception {
        mvc.perform(multipart("/landmarks")
                        .file(specimen())
                        .param("topRuler", "500")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("landmarks"))
                .andExpect(model().attribute("error", containsString("top_ruler 500")))
                .andExpect(model().attributeExists("supportedFormats"));
    }

    @Test
    @WithMockUser
    void form_isServed() throws Exception {
        mvc.perform(get("/landmarks"))
                .andExpect(status().isOk())
                .andExpect(view().name("landmarks"))
                .andExpect(model().attributeExists("supportedFormats"));
    }

    @Test
    @WithMockUser
    void api_returnsLandmarksAsJson() throws Exception {
        mvc.perform(multipart("/api/landmarks")
                        .file(specimen())
                        .param("topRuler", String.valueOf(SpecimenFixtures.TOP_RULER))
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(91))
                .andExpect(jsonPath("$.height").value(80))
                .andExpect(jsonPath("$.midline").value(41))
                .andExpect(jsonPath("$.landmarks.body_center", contains(34, 41)))
                .andExpect(jsonPath("$.landmarks.outer_pix_l", contains(11, 19)))
                .andExpect(jsonPath("$.landmarks.inner_pix_l", contains(49, 36)))
                .andExpect(jsonPath("$.landmarks.outer_pix_r", contains(11, 63)))
                .andExpect(jsonPath("$.landmarks.inner_pix_r", contains(49, 46)));
    }

    @Test
    @WithMockUser
    void api_rejectsNonPositiveRuler() throws Exception {
        mvc.perform(multipart("/api/landmarks")
                        .file(specimen())
                        .param("topRuler", "0")
                        .with(csrf()))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser
    void api_rulerBelowPicture_isBadRequest() throws Exception {
        mvc.perform(multipart("/api/landmarks")
                        .file(specimen())
                        .param("topRuler", "500")
                        .with(csrf()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unauthenticated_isRedirectedToLogin() throws Exception {
        mvc.perform(get("/landmarks"))
                .andExpect(status().is3xxRedirection())
                .andExpect(header().string("Location", containsString("/login")));
    }
}
