package com.agentgate.core.policy;

import com.agentgate.api.exception.PolicyConfigurationException;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 策略存储 (Immutable)
 * <p>
 * 职责：保存 角色 -> {可见表、可用工具、行级过滤模板} 的映射。
 * 进程启动时构建一次，以引用方式注入鉴权器与改写器，运行期只读。
 * </p>
 */
@Slf4j
public final class PolicyStore {

    public static final String USER_ID_PLACEHOLDER = "{user_id}";

    private final Map<Persona, PersonaPolicy> policies;

    private PolicyStore(Map<Persona, PersonaPolicy> policies) {
        EnumMap<Persona, PersonaPolicy> copy = new EnumMap<>(Persona.class);
        copy.putAll(policies);
        this.policies = Collections.unmodifiableMap(copy);
    }

    /**
     * 从 YAML 载体构建并校验
     *
     * @throws PolicyConfigurationException 角色非法或重复
     */
    public static PolicyStore from(PolicyDefinition definition) {
        if (definition == null || definition.getPersonas() == null) {
            throw new PolicyConfigurationException("Policy definition has no personas");
        }
        Builder builder = builder();
        Set<Persona> seen = new LinkedHashSet<>();
        for (PolicyDefinition.PersonaRules rules : definition.getPersonas()) {
            Persona persona = Persona.parse(rules.getName())
                    .orElseThrow(() -> new PolicyConfigurationException(
                            "Unknown persona in policy: " + rules.getName()));
            if (!seen.add(persona)) {
                throw new PolicyConfigurationException("Duplicate persona in policy: " + persona.id());
            }
            if (rules.getGroup() != null && !rules.getGroup().isBlank()) {
                builder.group(persona, rules.getGroup());
            }
            builder.allowTables(persona, nullSafe(rules.getTables()));
            builder.allowTools(persona, nullSafe(rules.getTools()));
            if (rules.getRowFilters() != null) {
                rules.getRowFilters().forEach((table, template) -> builder.rowFilter(persona, table, template));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 资源是否在角色的允许集合中；仅 TABLE 与 OPERATION 维度有允许集合
     */
    public boolean isAllowed(Persona persona, ResourceKind kind, String resourceName) {
        return resourceName != null && allowedResources(persona, kind).contains(resourceName);
    }

    public Set<String> allowedResources(Persona persona, ResourceKind kind) {
        PersonaPolicy policy = policyOf(persona);
        return switch (kind) {
            case TABLE -> policy.tables();
            case OPERATION -> policy.tools();
            default -> Set.of();
        };
    }

    public Map<String, String> rowFilters(Persona persona) {
        return policyOf(persona).rowFilters();
    }

    public String groupOf(Persona persona) {
        return policyOf(persona).group();
    }

    public PersonaPolicy policyOf(Persona persona) {
        PersonaPolicy policy = policies.get(persona);
        return policy != null ? policy : PersonaPolicy.empty(persona);
    }

    public Set<Persona> personas() {
        return policies.keySet();
    }

    private static List<String> nullSafe(List<String> values) {
        return values == null ? List.of() : values;
    }

    /**
     * 构建器，仅在启动期使用
     */
    public static final class Builder {

        private final Map<Persona, String> groups = new EnumMap<>(Persona.class);
        private final Map<Persona, Set<String>> tables = new EnumMap<>(Persona.class);
        private final Map<Persona, Set<String>> tools = new EnumMap<>(Persona.class);
        private final Map<Persona, Map<String, String>> rowFilters = new EnumMap<>(Persona.class);

        private Builder() {
        }

        public Builder group(Persona persona, String group) {
            groups.put(persona, group);
            return this;
        }

        public Builder allowTables(Persona persona, Iterable<String> names) {
            Set<String> set = tables.computeIfAbsent(persona, k -> new LinkedHashSet<>());
            names.forEach(set::add);
            return this;
        }

        public Builder allowTables(Persona persona, String... names) {
            return allowTables(persona, List.of(names));
        }

        public Builder allowTools(Persona persona, Iterable<String> names) {
            Set<String> set = tools.computeIfAbsent(persona, k -> new LinkedHashSet<>());
            names.forEach(set::add);
            return this;
        }

        public Builder allowTools(Persona persona, String... names) {
            return allowTools(persona, List.of(names));
        }

        public Builder rowFilter(Persona persona, String table, String template) {
            if (table == null || table.isBlank() || template == null || template.isBlank()) {
                throw new PolicyConfigurationException(
                        "Row filter for persona " + persona.id() + " needs a table and a template");
            }
            if (!template.contains(USER_ID_PLACEHOLDER)) {
                log.warn("Row filter for [{}].[{}] has no {} placeholder, it will not be user scoped",
                        persona.id(), table, USER_ID_PLACEHOLDER);
            }
            rowFilters.computeIfAbsent(persona, k -> new LinkedHashMap<>()).put(table, template);
            return this;
        }

        public PolicyStore build() {
            Set<Persona> declared = new LinkedHashSet<>();
            declared.addAll(groups.keySet());
            declared.addAll(tables.keySet());
            declared.addAll(tools.keySet());
            declared.addAll(rowFilters.keySet());

            Map<Persona, PersonaPolicy> result = new EnumMap<>(Persona.class);
            for (Persona persona : declared) {
                result.put(persona, new PersonaPolicy(
                        persona,
                        groups.getOrDefault(persona, persona.defaultGroup()),
                        tables.getOrDefault(persona, Set.of()),
                        tools.getOrDefault(persona, Set.of()),
                        rowFilters.getOrDefault(persona, Map.of())));
            }
            return new PolicyStore(result);
        }
    }
}
