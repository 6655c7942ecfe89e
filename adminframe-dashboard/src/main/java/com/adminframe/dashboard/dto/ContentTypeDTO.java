package com.adminframe.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentTypeDTO {

    private long id;

    @JsonProperty("app_label")
    private String appLabel;

    @JsonProperty("model")
    private String modelSlug;

    @JsonProperty("dotted_name")
    private String dottedName;

    @JsonProperty("is_virtual")
    private boolean virtual;
}
