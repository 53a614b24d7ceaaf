package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.CreateOrganizationRequest;
import com.example.organizationservice.dto.request.OrganizationFilterRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.response.OrganizationResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.exception.BadRequestException;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.security.ApiAccessDeniedHandler;
import com.example.organizationservice.security.ApiTokenAuthenticationEntryPoint;
import com.example.organizationservice.security.SecurityConfig;
import com.example.organizationservice.service.OrganizationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Organization endpoints are reachable without the API token.
 */
@WebMvcTest(OrganizationController.class)
@Import({SecurityConfig.class, ApiTokenAuthenticationEntryPoint.class, ApiAccessDeniedHandler.class})
class OrganizationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrganizationService organizationService;

    @Test
    void listWithoutTokenSucceeds() throws Exception {
        when(organizationService.listOrganizations(any(OrganizationFilterRequest.class), any(PaginationRequest.class)))
                .thenReturn(PageResponse.<OrganizationResponse>builder()
                        .items(List.of())
                        .page(1)
                        .perPage(10)
                        .build());

        mockMvc.perform(get("/api/v1/organizations").param("coords", "0,0;50,50"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-ID"))
                .andExpect(jsonPath("$.items").isEmpty())
                .andExpect(jsonPath("$.totalItems").value(0));
    }

    @Test
    void anonymousCallerCanFetchById() throws Exception {
        UUID organizationId = UUID.randomUUID();
        when(organizationService.getOrganizationById(organizationId))
                .thenReturn(OrganizationResponse.builder()
                        .id(organizationId)
                        .name("Horns and Hooves")
                        .phoneNumbers(List.of())
                        .activityIds(List.of())
                        .build());

        mockMvc.perform(get("/api/v1/organizations/{id}", organizationId).with(anonymous()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Horns and Hooves"));
    }

    @Test
    void createWithoutTokenReturns201() throws Exception {
        UUID buildingId = UUID.randomUUID();
        UUID organizationId = UUID.randomUUID();
        when(organizationService.createOrganization(any(CreateOrganizationRequest.class)))
                .thenReturn(OrganizationResponse.builder()
                        .id(organizationId)
                        .name("Horns and Hooves")
                        .phoneNumbers(List.of("+1234567890"))
                        .buildingId(buildingId)
                        .activityIds(List.of())
                        .build());

        mockMvc.perform(post("/api/v1/organizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Horns and Hooves\", \"phoneNumbers\": [\"+1234567890\"], "
                                + "\"buildingId\": \"" + buildingId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(organizationId.toString()))
                .andExpect(jsonPath("$.phoneNumbers[0]").value("+1234567890"));
    }

    @Test
    void missingActivitiesAreListedInDetails() throws Exception {
        UUID missing = UUID.randomUUID();
        when(organizationService.createOrganization(any(CreateOrganizationRequest.class)))
                .thenThrow(ResourceNotFoundException.activitiesNotFound(List.of(missing)));

        mockMvc.perform(post("/api/v1/organizations")
                        .header("X-Request-ID", "req-404")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Butcher\", \"buildingId\": \"" + UUID.randomUUID() + "\", "
                                + "\"activityIds\": [\"" + missing + "\"]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACTIVITY_NOT_FOUND"))
                .andExpect(jsonPath("$.details.activityIds[0]").value(missing.toString()))
                .andExpect(jsonPath("$.correlationId").value("req-404"));
    }

    @Test
    void invalidValueObjectIsBadRequest() throws Exception {
        when(organizationService.createOrganization(any(CreateOrganizationRequest.class)))
                .thenThrow(new BadRequestException("INVALID_PHONE_NUMBER", "Invalid phone number: 12345"));

        mockMvc.perform(post("/api/v1/organizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Butcher\", \"phoneNumbers\": [\"12345\"], "
                                + "\"buildingId\": \"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PHONE_NUMBER"))
                .andExpect(jsonPath("$.message").value("Invalid phone number: 12345"));
    }

    @Test
    void unexpectedIllegalArgumentDoesNotEchoItsMessage() throws Exception {
        when(organizationService.getOrganizationById(any(UUID.class)))
                .thenThrow(new IllegalArgumentException("org.hibernate.query.sqm.Foo: bad path 'x'"));

        mockMvc.perform(get("/api/v1/organizations/" + UUID.randomUUID()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Invalid request"));
    }

    @Test
    void missingBuildingIdFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/organizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Butcher\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.buildingId").exists());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/organizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        UUID organizationId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/organizations/{id}", organizationId))
                .andExpect(status().isNoContent());

        verify(organizationService).deleteOrganization(organizationId);
    }
}
