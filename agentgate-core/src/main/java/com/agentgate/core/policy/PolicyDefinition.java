package com.agentgate.core.policy;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应 agentgate-policy.yml 的根节点
 * 仅作为加载期的可变载体，运行期使用 {@link PolicyStore}
 */
@Getter
@Setter
public class PolicyDefinition {

    private List<PersonaRules> personas = new ArrayList<>();

    @Getter
    @Setter
    public static class PersonaRules {
        // 角色标识，例如 warehouse_manager
        private String name;
        // 目录用户组，缺省取角色默认组
        private String group;
        private List<String> tables = new ArrayList<>();
        private List<String> tools = new ArrayList<>();
        // 表名 -> 过滤模板（含 {user_id} 占位符）
        private Map<String, String> rowFilters = new LinkedHashMap<>();
    }
}
