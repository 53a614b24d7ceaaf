package com.example.organizationservice.service;

import com.example.organizationservice.dto.request.CreateOrganizationRequest;
import com.example.organizationservice.dto.request.OrganizationFilterRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchOrganizationRequest;
import com.example.organizationservice.dto.request.UpdateOrganizationRequest;
import com.example.organizationservice.dto.response.OrganizationResponse;
import com.example.organizationservice.dto.response.PageResponse;

import java.util.UUID;

/**
 * Service interface for organization operations.
 * Each operation runs in a single transaction covering the organization row
 * and its activity associations.
 */
public interface OrganizationService {

    /**
     * Create an organization and its activity associations.
     * Validates the building and every activity before writing anything.
     *
     * @param request Create request
     * @return created organization with its activity ids
     */
    OrganizationResponse createOrganization(CreateOrganizationRequest request);

    OrganizationResponse getOrganizationById(UUID organizationId);

    /**
     * List organizations matching the filter. Activity ids are attached to
     * the whole page with one query.
     */
    PageResponse<OrganizationResponse> listOrganizations(OrganizationFilterRequest filter,
                                                         PaginationRequest pagination);

    /**
     * Replace an organization; its activity set is replaced as a whole.
     */
    OrganizationResponse updateOrganization(UUID organizationId, UpdateOrganizationRequest request);

    /**
     * Update only the fields present in the request.
     */
    OrganizationResponse patchOrganization(UUID organizationId, PatchOrganizationRequest request);

    /**
     * Delete an organization together with its associations.
     */
    void deleteOrganization(UUID organizationId);
}
