package com.example.organizationservice.dto.request;

import com.example.organizationservice.exception.BadRequestException;
import com.example.organizationservice.specification.SortDirection;
import com.example.organizationservice.specification.SortSpecification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses repeated {@code sort=field,asc|desc} parameters against the sortable
 * fields of an entity. The direction defaults to ascending.
 *
 * Spring splits a single comma separated value into several list elements,
 * so the parameters are flattened into tokens and a direction token is
 * attached to the field before it.
 */
public final class SortParameters {

    private static final Set<String> DIRECTIONS = Set.of("asc", "desc");

    private SortParameters() {
    }

    /**
     * @param sortable API field name to unbound sort template
     * @throws BadRequestException on an unknown field or a misplaced direction
     */
    public static List<SortSpecification> parse(List<String> params, Map<String, SortSpecification> sortable) {
        List<SortSpecification> sorts = new ArrayList<>();
        if (params == null) {
            return sorts;
        }

        List<String> tokens = new ArrayList<>();
        for (String param : params) {
            if (param == null) {
                continue;
            }
            for (String token : param.split(",")) {
                if (!token.isBlank()) {
                    tokens.add(token.trim());
                }
            }
        }

        for (int i = 0; i < tokens.size(); i++) {
            String field = tokens.get(i);
            if (isDirection(field)) {
                throw BadRequestException.invalidSort(
                        "Invalid sort parameter: direction " + field + " without a field. Expected field,asc|desc");
            }
            SortSpecification template = sortable.get(field);
            if (template == null) {
                throw BadRequestException.invalidSort(
                        "Unsupported sort field: " + field + ". Allowed: " + sortable.keySet());
            }
            SortDirection direction = SortDirection.ASC;
            if (i + 1 < tokens.size() && isDirection(tokens.get(i + 1))) {
                direction = SortDirection.fromString(tokens.get(++i));
            }
            sorts.add(template.withDirection(direction));
        }
        return sorts;
    }

    private static boolean isDirection(String token) {
        return DIRECTIONS.contains(token.toLowerCase(Locale.ROOT));
    }
}
