package com.example.organizationservice.dto.response;

import com.example.organizationservice.entity.Activity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityResponse {

    private UUID id;
    private UUID parentId;
    private String name;

    public static ActivityResponse from(Activity activity) {
        return ActivityResponse.builder()
                .id(activity.getId())
                .parentId(activity.getParentId())
                .name(activity.getName())
                .build();
    }
}
