package com.adminframe.core.query;

import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FilterOp;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.core.config.AdminFrameConfig;
import com.adminframe.core.descriptor.ModelDescriptor;
import com.adminframe.core.support.BlogFixtures;
import com.adminframe.core.support.BlogFixtures.PostDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ListQueryParser 单元测试")
class ListQueryParserTest {

    private ListQueryParser parser;
    private PostDescriptor descriptor;

    @BeforeEach
    void setUp() {
        parser = new ListQueryParser(AdminFrameConfig.builder().defaultPerPage(20).maxPerPage(50).build());
        descriptor = new PostDescriptor(BlogFixtures.posts(0));
    }

    @Nested
    @DisplayName("参数提取与分页")
    class ParamsTests {

        @Test
        @DisplayName("提取 filter.* 参数并忽略空值")
        void extractsFilterParams() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("search", "hello");
            params.put("order", "-views");
            params.put("filter.status", "draft");
            params.put("filter.views.gte", "10");
            params.put("filter.author", "");
            params.put("page_num", "2");

            ListQuery query = parser.fromParams(params);

            assertEquals("hello", query.search());
            assertEquals("-views", query.order());
            assertEquals(Map.of("status", "draft", "views.gte", "10"), query.filters());
            assertEquals(2, query.pageNum());
            assertNull(query.perPage());
        }

        @Test
        @DisplayName("每页条数被限制在上限之内")
        void perPageIsClamped() {
            PageRequest page = parser.page(new ListQuery(null, null, Map.of(), 3, 500));

            assertEquals(3, page.page());
            assertEquals(50, page.perPage());
            assertEquals(100, page.offset());
            assertEquals(20, parser.page(ListQuery.empty()).perPage());
        }

        @Test
        @DisplayName("非法页码返回 422")
        void invalidPageRejected() {
            assertThrows(ValidationException.class, () -> parser.fromParams(Map.of("page_num", "abc")));
            assertThrows(ValidationException.class,
                    () -> parser.page(new ListQuery(null, null, Map.of(), 0, null)));
        }

        @Test
        @DisplayName("偏移量超出范围的页码返回 422")
        void pageBeyondOffsetRangeRejected() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> parser.page(parser.fromParams(Map.of("page_num", "300000000", "per_page", "50"))));
            assertTrue(e.getErrors().containsKey("page_num"));

            PageRequest last = parser.page(new ListQuery(null, null, Map.of(), 42949673, 50));
            assertEquals(2147483600, last.offset());
        }
    }

    @Nested
    @DisplayName("过滤条件")
    class FilterTests {

        @Test
        @DisplayName("按字段类型转换过滤值")
        void coercesByFieldKind() {
            Map<String, String> filters = new LinkedHashMap<>();
            filters.put("views.gte", "30");
            filters.put("featured", "yes");
            filters.put("status.in", "draft, published");

            ListCriteria criteria = parser.criteria(descriptor, null, null, filters, false);

            assertEquals(List.of(
                    new FilterSpec("views", FilterOp.GTE, 30L),
                    new FilterSpec("featured", FilterOp.EQ, Boolean.TRUE),
                    new FilterSpec("status", FilterOp.IN, List.of("draft", "published"))), criteria.filters());
        }

        @Test
        @DisplayName("eq null 转换为空值判断")
        void nullLiteralBecomesIsNull() {
            ListCriteria criteria = parser.criteria(descriptor, null, null, Map.of("author", "null"), false);

            assertEquals(FilterOp.IS_NULL, criteria.filters().get(0).op());
        }

        @Test
        @DisplayName("未声明的字段、不允许的操作符和非法值都返回 422")
        void invalidFiltersRejected() {
            ValidationException unknown = assertThrows(ValidationException.class,
                    () -> parser.criteria(descriptor, null, null, Map.of("title", "x"), false));
            assertTrue(unknown.getErrors().containsKey("filter.title"));

            assertThrows(ValidationException.class,
                    () -> parser.criteria(descriptor, null, null, Map.of("featured.gte", "1"), false));
            assertThrows(ValidationException.class,
                    () -> parser.criteria(descriptor, null, null, Map.of("views", "many"), false));
            assertThrows(ValidationException.class,
                    () -> parser.criteria(descriptor, null, null, Map.of("status", "archived"), false));
        }
    }

    @Nested
    @DisplayName("搜索与排序")
    class SearchAndOrderTests {

        @Test
        @DisplayName("不可排序的字段在浏览时回退到缺省排序，在严格模式下报错")
        void unsortableOrder() {
            ListCriteria lenient = parser.criteria(descriptor, null, "body", Map.of(), false);
            assertEquals(List.of("-id"), lenient.ordering());

            ValidationException e = assertThrows(ValidationException.class,
                    () -> parser.criteria(descriptor, null, "body", Map.of(), true));
            assertTrue(e.getErrors().containsKey("order"));
        }

        @Test
        @DisplayName("列表列可以排序")
        void listColumnIsSortable() {
            ListCriteria criteria = parser.criteria(descriptor, null, "-views", Map.of(), true);

            assertEquals("-views", criteria.orderToken());
        }

        @Test
        @DisplayName("没有搜索字段时浏览忽略搜索，严格模式报错")
        void searchWithoutFields() {
            ModelDescriptor<Map<String, Object>> plain = new ModelDescriptor<>(BlogFixtures.posts(0));

            assertFalse(parser.criteria(plain, "x", null, Map.of(), false).hasSearch());
            assertThrows(ValidationException.class, () -> parser.criteria(plain, "x", null, Map.of(), true));
            assertEquals(List.of("-id"), parser.criteria(plain, null, null, Map.of(), false).ordering());
        }
    }
}
