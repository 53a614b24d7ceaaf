package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.CreateBuildingRequest;
import com.example.organizationservice.dto.response.BuildingResponse;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.security.ApiAccessDeniedHandler;
import com.example.organizationservice.security.ApiTokenAuthenticationEntryPoint;
import com.example.organizationservice.security.SecurityConfig;
import com.example.organizationservice.service.BuildingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BuildingController.class)
@Import({SecurityConfig.class, ApiTokenAuthenticationEntryPoint.class, ApiAccessDeniedHandler.class})
class BuildingControllerTest {

    private static final String BEARER = "Bearer test-api-token-0123456789abcdefghijklmnop";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BuildingService buildingService;

    @Test
    void createRequiresToken() throws Exception {
        mockMvc.perform(post("/api/v1/buildings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"Lenina 1\", \"latitude\": 10.0, \"longitude\": 20.0}"))
                .andExpect(status().isUnauthorized());

        verify(buildingService, never()).createBuilding(any());
    }

    @Test
    void createWithTokenReturns201() throws Exception {
        UUID buildingId = UUID.randomUUID();
        when(buildingService.createBuilding(any(CreateBuildingRequest.class)))
                .thenReturn(BuildingResponse.builder()
                        .id(buildingId)
                        .address("Lenina 1")
                        .latitude(10.0)
                        .longitude(20.0)
                        .build());

        mockMvc.perform(post("/api/v1/buildings")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"Lenina 1\", \"latitude\": 10.0, \"longitude\": 20.0}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(buildingId.toString()))
                .andExpect(jsonPath("$.latitude").value(10.0));
    }

    @Test
    void unknownBuildingIsNotFound() throws Exception {
        UUID buildingId = UUID.randomUUID();
        when(buildingService.getBuildingById(buildingId))
                .thenThrow(ResourceNotFoundException.buildingNotFound(buildingId));

        mockMvc.perform(get("/api/v1/buildings/{id}", buildingId).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BUILDING_NOT_FOUND"))
                .andExpect(jsonPath("$.details.buildingId").value(buildingId.toString()));
    }

    @Test
    void deleteWithTokenReturnsNoContent() throws Exception {
        UUID buildingId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/buildings/{id}", buildingId).header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isNoContent());

        verify(buildingService).deleteBuilding(buildingId);
    }
}
