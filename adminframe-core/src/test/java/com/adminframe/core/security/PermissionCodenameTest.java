package com.adminframe.core.security;

import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.content.ContentTypeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PermissionCodenameTest {

    private ContentTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ContentTypeRegistry();
        registry.register("blog", "post", "blog.post", false);
        registry.register("shop", "cards.sales-total", "shop.cards.sales-total", true);
        registry.finalizeRegistry();
    }

    @Test
    void parsesModelCodename() {
        PermissionCodename codename = PermissionCodename.parse("blog.post.change", registry);

        assertEquals("blog.post", codename.contentType().dottedName());
        assertEquals(PermAction.CHANGE, codename.action());
        assertEquals("blog.post.change", codename.format());
    }

    @Test
    void parsesVirtualCodenameWithDottedSlug() {
        PermissionCodename codename = PermissionCodename.parse("shop.cards.sales-total.view", registry);

        assertTrue(codename.contentType().virtual());
        assertEquals(PermAction.VIEW, codename.action());
    }

    @Test
    void bareActionIsGlobal() {
        PermissionCodename codename = PermissionCodename.parse("delete", registry);

        assertTrue(codename.isGlobal());
        assertEquals("delete", codename.format());
    }

    @Test
    void rejectsUnknownContentTypeAndAction() {
        ValidationException unknownCt = assertThrows(ValidationException.class,
                () -> PermissionCodename.parse("blog.page.view", registry));
        assertTrue(unknownCt.getErrors().containsKey("codename"));

        assertThrows(ValidationException.class, () -> PermissionCodename.parse("blog.post.publish", registry));
        assertThrows(ValidationException.class, () -> PermissionCodename.parse("", registry));
    }
}
