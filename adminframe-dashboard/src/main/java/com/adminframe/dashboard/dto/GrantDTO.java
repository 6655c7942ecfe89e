package com.adminframe.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 授权记录，codename 形如 "blog.post.change"，全局权限为 "change"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrantDTO {

    /**
     * user 或 group
     */
    @JsonProperty("grantee_type")
    private String granteeType;

    @JsonProperty("grantee_id")
    private String granteeId;

    private String codename;
}
