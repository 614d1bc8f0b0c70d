package com.agentgate.core.policy;

import com.agentgate.api.exception.PolicyConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 策略加载器：YAML -> PolicyDefinition -> PolicyStore
 */
@Slf4j
public class PolicyLoader {

    /**
     * 随 core 发布的默认策略
     */
    public static final String DEFAULT_POLICY_RESOURCE = "agentgate-policy.yml";

    private PolicyLoader() {
    }

    public static PolicyStore load(InputStream inputStream) {
        return PolicyStore.from(parseDefinition(inputStream));
    }

    public static PolicyStore load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading policy from {}", path);
            return load(in);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy file: " + path, e);
        }
    }

    public static PolicyStore loadDefault() {
        ClassLoader cl = PolicyLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(DEFAULT_POLICY_RESOURCE)) {
            if (in == null) {
                throw new PolicyConfigurationException("Default policy not found on classpath: " + DEFAULT_POLICY_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read default policy", e);
        }
    }

    public static PolicyDefinition parseDefinition(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions；不放开全局标签
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(PolicyDefinition.class, options);
        Yaml yaml = new Yaml(constructor);
        try {
            PolicyDefinition definition = yaml.load(inputStream);
            if (definition == null) {
                throw new PolicyConfigurationException("Policy document is empty");
            }
            return definition;
        } catch (YAMLException e) {
            throw new PolicyConfigurationException("Malformed policy document: " + e.getMessage(), e);
        }
    }
}
