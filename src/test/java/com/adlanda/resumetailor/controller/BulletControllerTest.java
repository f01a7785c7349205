package com.adlanda.resumetailor.controller;

import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.BulletRequest;
import com.adlanda.resumetailor.service.BulletService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BulletController.class)
class BulletControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BulletService bulletService;

    @Test
    void create_returnsBulletWithDefaultImpact() throws Exception {
        Bullet bullet = new Bullet("b1", "exp-1", "Built Go services");
        bullet.setKeywords(List.of("Go"));
        when(bulletService.createBullet(eq("user-1"), eq("exp-1"), any(BulletRequest.class))).thenReturn(bullet);

        mockMvc.perform(post("/api/v1/experiences/exp-1/bullets")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"content": "Built Go services", "keywords": ["Go"]}
                            """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("b1"))
                .andExpect(jsonPath("$.impactScore").value(50))
                .andExpect(jsonPath("$.keywords[0]").value("Go"));
    }

    @Test
    void create_impactScoreOutOfRange_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/experiences/exp-1/bullets")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"x\", \"impactScore\": 150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.impactScore").exists());
    }

    @Test
    void delete_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/bullets/b1").header("X-User-Id", "user-1"))
                .andExpect(status().isNoContent());

        verify(bulletService).deleteBullet("user-1", "b1");
    }

    @Test
    void delete_unknownBullet_returnsNotFound() throws Exception {
        doThrow(new ResourceNotFoundException("bullet", "b9")).when(bulletService).deleteBullet("user-1", "b9");

        mockMvc.perform(delete("/api/v1/bullets/b9").header("X-User-Id", "user-1"))
                .andExpect(status().isNotFound());
    }
}
