package com.adminframe.dashboard.service;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.Grant;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.security.GrantService;
import com.adminframe.core.security.PermissionCodename;
import com.adminframe.dashboard.dto.ContentTypeDTO;
import com.adminframe.dashboard.dto.GrantDTO;
import com.adminframe.dashboard.dto.MembershipDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * RBAC 管理：授权增删、组成员维护、内容类型浏览
 * <p>
 * 所有写操作都经过 {@link GrantService}，从而遵循授权策略并触发权限缓存失效。
 */
@Slf4j
@RequiredArgsConstructor
public class DashboardService {

    private final GrantService grantService;
    private final ContentTypeRegistry registry;

    public List<ContentTypeDTO> listContentTypes() {
        return registry.all().stream()
                .map(ct -> ContentTypeDTO.builder()
                        .id(ct.id().value())
                        .appLabel(ct.appLabel())
                        .modelSlug(ct.modelSlug())
                        .dottedName(ct.dottedName())
                        .virtual(ct.virtual())
                        .build())
                .toList();
    }

    public List<GrantDTO> listGrants() {
        return grantService.listGrants().stream()
                .map(this::toDTO)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(GrantDTO::getGranteeType)
                        .thenComparing(GrantDTO::getGranteeId)
                        .thenComparing(GrantDTO::getCodename))
                .toList();
    }

    public GrantDTO grant(GrantDTO dto) {
        PermissionCodename codename = PermissionCodename.parse(dto.getCodename(), registry);
        Grant.GranteeType type = granteeType(dto.getGranteeType());
        if (type == Grant.GranteeType.USER) {
            grantService.grantToUser(dto.getGranteeId(), codename.contentType(), codename.action());
        } else {
            grantService.grantToGroup(dto.getGranteeId(), codename.contentType(), codename.action());
        }
        return normalized(type, dto.getGranteeId(), codename);
    }

    public GrantDTO revoke(GrantDTO dto) {
        PermissionCodename codename = PermissionCodename.parse(dto.getCodename(), registry);
        Grant.GranteeType type = granteeType(dto.getGranteeType());
        if (type == Grant.GranteeType.USER) {
            grantService.revokeFromUser(dto.getGranteeId(), codename.contentType(), codename.action());
        } else {
            grantService.revokeFromGroup(dto.getGranteeId(), codename.contentType(), codename.action());
        }
        return normalized(type, dto.getGranteeId(), codename);
    }

    public MembershipDTO members(String groupId) {
        List<String> members = grantService.membersOf(groupId).stream().sorted().toList();
        return MembershipDTO.builder().groupId(groupId).members(members).build();
    }

    public MembershipDTO addMember(String groupId, String userId) {
        grantService.addMember(groupId, userId);
        return members(groupId);
    }

    public MembershipDTO removeMember(String groupId, String userId) {
        grantService.removeMember(groupId, userId);
        return members(groupId);
    }

    // 授权指向的内容类型已不在注册表中时忽略该记录
    private Optional<GrantDTO> toDTO(Grant grant) {
        ContentType contentType = null;
        if (!grant.isGlobal()) {
            contentType = registry.getById(grant.contentType()).orElse(null);
            if (contentType == null) {
                log.debug("[AdminFrame] Skipping grant on unknown content type id {}", grant.contentType());
                return Optional.empty();
            }
        }
        return Optional.of(GrantDTO.builder()
                .granteeType(grant.granteeType().name().toLowerCase(Locale.ROOT))
                .granteeId(grant.granteeId())
                .codename(PermissionCodename.format(contentType, grant.action()))
                .build());
    }

    private static GrantDTO normalized(Grant.GranteeType type, String granteeId, PermissionCodename codename) {
        return GrantDTO.builder()
                .granteeType(type.name().toLowerCase(Locale.ROOT))
                .granteeId(granteeId)
                .codename(codename.format())
                .build();
    }

    private static Grant.GranteeType granteeType(String raw) {
        if (raw != null) {
            switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "user":
                    return Grant.GranteeType.USER;
                case "group":
                    return Grant.GranteeType.GROUP;
                default:
                    break;
            }
        }
        throw new ValidationException("grantee_type", "Expected 'user' or 'group'");
    }
}
