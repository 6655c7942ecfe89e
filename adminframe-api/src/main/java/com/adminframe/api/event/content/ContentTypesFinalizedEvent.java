package com.adminframe.api.event.content;

import com.adminframe.api.event.AbstractAdminEvent;
import lombok.Getter;

/**
 * 内容类型注册表完成一次 finalize
 */
@Getter
public class ContentTypesFinalizedEvent extends AbstractAdminEvent {

    private final int total;
    private final int published;

    public ContentTypesFinalizedEvent(int total, int published) {
        super();
        this.total = total;
        this.published = published;
    }
}
