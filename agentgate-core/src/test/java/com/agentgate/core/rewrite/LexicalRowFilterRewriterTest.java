package com.agentgate.core.rewrite;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.context.UserContext;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.policy.PolicyLoader;
import com.agentgate.core.policy.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("LexicalRowFilterRewriter 单元测试")
class LexicalRowFilterRewriterTest {

    private static final String WAREHOUSE_FILTER =
            "warehouse_code IN (SELECT warehouse_code FROM user_warehouses WHERE user_id = 'u-7')";

    private InMemoryAuditSink auditLog;
    private LexicalRowFilterRewriter rewriter;

    @BeforeEach
    void setUp() {
        auditLog = new InMemoryAuditSink();
        rewriter = new LexicalRowFilterRewriter(PolicyLoader.loadDefault(), auditLog);
    }

    private static UserContext user(String persona) {
        return UserContext.builder().userId("u-7").persona(persona).build();
    }

    private static int count(String text, String token) {
        Matcher m = Pattern.compile("\\b" + token + "\\b", Pattern.CASE_INSENSITIVE).matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    @Nested
    @DisplayName("不改写的情况")
    class Unchanged {

        @Test
        @DisplayName("没有规则的角色原样返回")
        void noRulesReturnsInput() {
            String sql = "SELECT * FROM warehouse_product WHERE qty > 5";

            assertSame(sql, rewriter.rewrite(user("procurement_specialist"), sql));
            assertEquals(0, auditLog.size());
        }

        @Test
        @DisplayName("缺失或非法角色原样返回")
        void missingOrInvalidPersona() {
            String sql = "SELECT * FROM warehouse_product";

            assertSame(sql, rewriter.rewrite(UserContext.builder().userId("u").build(), sql));
            assertSame(sql, rewriter.rewrite(user("janitor"), sql));
            assertNull(rewriter.rewrite(user("warehouse_manager"), null));
        }

        @Test
        @DisplayName("未引用规则表时原样返回")
        void unreferencedTable() {
            String sql = "SELECT name FROM product";

            assertEquals(sql, rewriter.rewrite(user("warehouse_manager"), sql));
            assertEquals(0, auditLog.size());
        }
    }

    @Nested
    @DisplayName("注入")
    class Injection {

        @Test
        @DisplayName("已有 WHERE 时前置条件")
        void mergesIntoExistingWhere() {
            String sql = "SELECT * FROM warehouse_product WHERE qty > 5";

            String rewritten = rewriter.rewrite(user("warehouse_manager"), sql);

            assertEquals("SELECT * FROM warehouse_product WHERE (" + WAREHOUSE_FILTER + ") AND qty > 5", rewritten);
        }

        @Test
        @DisplayName("没有 WHERE 时追加在表引用之后")
        void appendsWhereAfterTable() {
            String sql = "SELECT * FROM warehouse_product ORDER BY qty";

            String rewritten = rewriter.rewrite(user("warehouse_manager"), sql);

            assertEquals("SELECT * FROM warehouse_product WHERE (" + WAREHOUSE_FILTER + ") ORDER BY qty", rewritten);
        }

        @Test
        @DisplayName("合并到已有 WHERE 时不新增 WHERE 关键字")
        void mergeKeepsWhereCount() {
            PolicyStore store = PolicyStore.builder()
                    .allowTables(Persona.FIELD_ENGINEER, "product")
                    .rowFilter(Persona.FIELD_ENGINEER, "product", "owner = '{user_id}'")
                    .build();
            LexicalRowFilterRewriter simple = new LexicalRowFilterRewriter(store, auditLog);
            String sql = "SELECT * FROM product WHERE price > 10";

            String rewritten = simple.rewrite(user("field_engineer"), sql);

            assertEquals(count(sql, "WHERE"), count(rewritten, "WHERE"));
            assertEquals("SELECT * FROM product WHERE (owner = 'u-7') AND price > 10", rewritten);
        }

        @Test
        @DisplayName("多张规则表依次应用")
        void appliesEveryRuleInOrder() {
            String sql = "SELECT * FROM warehouse_product w JOIN sales_order_header h"
                    + " ON h.warehouse_code = w.warehouse_code WHERE h.status = 'open'";

            String rewritten = rewriter.rewrite(user("warehouse_manager"), sql);

            assertTrue(rewritten.endsWith("WHERE (" + WAREHOUSE_FILTER + ") AND (" + WAREHOUSE_FILTER
                    + ") AND h.status = 'open'"), rewritten);
            assertEquals(1, count(sql, "WHERE"));
            List<AuditEvent> events = auditLog.events();
            assertEquals(1, events.size());
            assertEquals(List.of("warehouse_product", "sales_order_header"), events.get(0).getMetadata().get("tables"));
        }

        @Test
        @DisplayName("用户标识中的单引号被转义")
        void escapesQuotesInUserId() {
            UserContext ctx = UserContext.builder().userId("o'brien").persona("field_engineer").build();

            String rewritten = rewriter.rewrite(ctx, "SELECT * FROM sales_order_header");

            assertTrue(rewritten.contains("user_id = 'o''brien'"), rewritten);
        }

        @Test
        @DisplayName("改写时写一条 APPLIED 审计")
        void auditsAppliedRewrite() {
            String longTail = " AND note = '" + "x".repeat(200) + "'";
            String sql = "SELECT * FROM sales_order_header WHERE status = 'open'" + longTail;

            rewriter.rewrite(user("field_engineer"), sql);

            assertEquals(1, auditLog.size());
            AuditEvent event = auditLog.events().get(0);
            assertEquals(Decision.APPLIED, event.getDecision());
            assertEquals(ResourceKind.QUERY, event.getResourceType());
            assertEquals("sql_query", event.getResourceName());
            assertEquals("row_level_security", event.getAction());
            assertEquals(sql.substring(0, 100), event.getMetadata().get("original_query"));
            assertEquals(true, event.getMetadata().get("modified"));
        }
    }

    @Nested
    @DisplayName("审计失败")
    class AuditFailure {

        @Test
        @DisplayName("审计异常不影响改写结果")
        void auditFailureDoesNotChangeRewrite() {
            AuditSink failingSink = mock(AuditSink.class);
            doThrow(new IllegalStateException("disk full")).when(failingSink).record(any());
            LexicalRowFilterRewriter fragile = new LexicalRowFilterRewriter(PolicyLoader.loadDefault(), failingSink);
            String sql = "SELECT * FROM warehouse_product WHERE qty > 5";

            String rewritten = assertDoesNotThrow(() -> fragile.rewrite(user("warehouse_manager"), sql));

            assertEquals(rewriter.rewrite(user("warehouse_manager"), sql), rewritten);
            assertEquals("SELECT * FROM warehouse_product WHERE (" + WAREHOUSE_FILTER + ") AND qty > 5", rewritten);
            verify(failingSink).record(any());
        }
    }
}
