package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.ActivityFilterRequest;
import com.example.organizationservice.dto.request.CreateActivityRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.response.ActivityResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.exception.ConflictException;
import com.example.organizationservice.security.ApiAccessDeniedHandler;
import com.example.organizationservice.security.ApiTokenAuthenticationEntryPoint;
import com.example.organizationservice.security.SecurityConfig;
import com.example.organizationservice.service.ActivityService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ActivityController.class)
@Import({SecurityConfig.class, ApiTokenAuthenticationEntryPoint.class, ApiAccessDeniedHandler.class})
class ActivityControllerTest {

    private static final String TOKEN = "test-api-token-0123456789abcdefghijklmnop";
    private static final String BEARER = "Bearer " + TOKEN;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ActivityService activityService;

    @Test
    void missingTokenIsUnauthorizedWithCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/activities").header("X-Request-ID", "req-401"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Request-ID", "req-401"))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.correlationId").value("req-401"));

        verify(activityService, never()).listActivities(any(), any());
    }

    @Test
    void wrongTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/activities").header(HttpHeaders.AUTHORIZATION, "Bearer not-the-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void validTokenListsActivities() throws Exception {
        UUID id = UUID.randomUUID();
        PageResponse<ActivityResponse> page = PageResponse.<ActivityResponse>builder()
                .items(List.of(ActivityResponse.builder().id(id).name("Food").build()))
                .totalItems(1)
                .totalPages(1)
                .page(1)
                .perPage(10)
                .build();
        when(activityService.listActivities(any(ActivityFilterRequest.class), any(PaginationRequest.class)))
                .thenReturn(page);

        mockMvc.perform(get("/api/v1/activities").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value(id.toString()))
                .andExpect(jsonPath("$.totalItems").value(1))
                .andExpect(jsonPath("$.hasNext").value(false));
    }

    @Test
    void perPageAboveLimitIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/activities")
                        .param("perPage", "101")
                        .header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.perPage").exists());
    }

    @Test
    void blankNameIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/activities")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.name").exists());

        verify(activityService, never()).createActivity(any());
    }

    @Test
    void nestingConflictMapsTo409() throws Exception {
        UUID parentId = UUID.randomUUID();
        when(activityService.createActivity(any(CreateActivityRequest.class)))
                .thenThrow(ConflictException.activityMaximumNesting(parentId, 3));

        mockMvc.perform(post("/api/v1/activities")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Smoked\", \"parentId\": \"" + parentId + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACTIVITY_MAXIMUM_NESTING"));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/activities/not-a-uuid").header(HttpHeaders.AUTHORIZATION, BEARER))
                .andExpect(status().isBadRequest());
    }
}
