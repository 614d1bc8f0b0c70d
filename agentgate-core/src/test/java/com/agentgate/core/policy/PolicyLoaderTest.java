package com.agentgate.core.policy;

import com.agentgate.api.exception.PolicyConfigurationException;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyLoader 单元测试")
class PolicyLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static InputStream fixture(String name) {
        InputStream in = PolicyLoaderTest.class.getClassLoader().getResourceAsStream("policies/" + name);
        assertNotNull(in, "fixture missing: " + name);
        return in;
    }

    @Nested
    @DisplayName("默认策略")
    class DefaultPolicy {

        @Test
        @DisplayName("包含三个角色")
        void shouldDeclareAllPersonas() {
            PolicyStore store = PolicyLoader.loadDefault();

            assertEquals(Set.of(Persona.values()), store.personas());
        }

        @Test
        @DisplayName("仓库经理的表与过滤规则")
        void warehouseManagerPolicy() {
            PolicyStore store = PolicyLoader.loadDefault();

            assertEquals(Set.of("product", "warehouse_product", "sales_order_header", "sales_order_line"),
                    store.allowedResources(Persona.WAREHOUSE_MANAGER, ResourceKind.TABLE));
            assertTrue(store.isAllowed(Persona.WAREHOUSE_MANAGER, ResourceKind.OPERATION, "forecast_demand"));
            assertEquals(Set.of("warehouse_product", "sales_order_header"),
                    store.rowFilters(Persona.WAREHOUSE_MANAGER).keySet());
            assertEquals("warehouse_managers", store.groupOf(Persona.WAREHOUSE_MANAGER));
        }

        @Test
        @DisplayName("采购专员没有行级过滤")
        void procurementHasNoRowFilters() {
            PolicyStore store = PolicyLoader.loadDefault();

            assertTrue(store.rowFilters(Persona.PROCUREMENT_SPECIALIST).isEmpty());
            assertFalse(store.isAllowed(Persona.PROCUREMENT_SPECIALIST, ResourceKind.TABLE, "sales_order_header"));
        }
    }

    @Nested
    @DisplayName("自定义策略")
    class CustomPolicy {

        @Test
        @DisplayName("未声明用户组时使用角色默认组")
        void shouldFallBackToDefaultGroup() {
            PolicyStore store = PolicyLoader.load(fixture("minimal-policy.yml"));

            assertEquals("field_engineers", store.groupOf(Persona.FIELD_ENGINEER));
            assertEquals(Set.of("product"), store.allowedResources(Persona.FIELD_ENGINEER, ResourceKind.TABLE));
            assertEquals("owner = '{user_id}'", store.rowFilters(Persona.FIELD_ENGINEER).get("product"));
        }

        @Test
        @DisplayName("未声明的角色没有任何权限")
        void undeclaredPersonaIsEmpty() {
            PolicyStore store = PolicyLoader.load(fixture("minimal-policy.yml"));

            assertTrue(store.allowedResources(Persona.WAREHOUSE_MANAGER, ResourceKind.TABLE).isEmpty());
            assertTrue(store.allowedResources(Persona.WAREHOUSE_MANAGER, ResourceKind.OPERATION).isEmpty());
        }

        @Test
        @DisplayName("未知角色被拒绝")
        void shouldRejectUnknownPersona() {
            PolicyConfigurationException e = assertThrows(PolicyConfigurationException.class,
                    () -> PolicyLoader.load(fixture("unknown-persona.yml")));
            assertTrue(e.getMessage().contains("auditor"));
        }

        @Test
        @DisplayName("重复角色被拒绝")
        void shouldRejectDuplicatePersona() {
            assertThrows(PolicyConfigurationException.class,
                    () -> PolicyLoader.load(fixture("duplicate-persona.yml")));
        }

        @Test
        @DisplayName("空文档被拒绝")
        void shouldRejectEmptyDocument() {
            assertThrows(PolicyConfigurationException.class, () -> PolicyLoader.load(yaml("")));
        }

        @Test
        @DisplayName("格式错误被包装为配置异常")
        void shouldWrapMalformedYaml() {
            assertThrows(PolicyConfigurationException.class,
                    () -> PolicyLoader.load(yaml("personas: [ {name: field_engineer")));
        }

        @Test
        @DisplayName("空白的过滤模板被拒绝")
        void shouldRejectBlankTemplate() {
            String text = "personas:\n  - name: field_engineer\n    rowFilters:\n      product: \"\"\n";
            assertThrows(PolicyConfigurationException.class, () -> PolicyLoader.load(yaml(text)));
        }
    }
}
