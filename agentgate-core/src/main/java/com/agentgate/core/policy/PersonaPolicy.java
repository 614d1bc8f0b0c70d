package com.agentgate.core.policy;

import com.agentgate.api.security.Persona;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 单个角色的策略快照 (Immutable)
 *
 * @param persona    角色
 * @param group      对应的用户组
 * @param tables     允许访问的表
 * @param tools      允许调用的工具
 * @param rowFilters 表名到行级过滤模板，保持声明顺序
 */
public record PersonaPolicy(Persona persona,
                            String group,
                            Set<String> tables,
                            Set<String> tools,
                            Map<String, String> rowFilters) {

    public PersonaPolicy {
        tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
        tools = Collections.unmodifiableSet(new LinkedHashSet<>(tools));
        rowFilters = Collections.unmodifiableMap(new LinkedHashMap<>(rowFilters));
    }

    static PersonaPolicy empty(Persona persona) {
        return new PersonaPolicy(persona, persona.defaultGroup(), Set.of(), Set.of(), Map.of());
    }
}
