/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.deploy.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Настройки подсистемы развертывания.
 *
 * Встроенные значения по умолчанию лежат в classpath-ресурсе {@code deploy-defaults.json},
 * пользовательский файл (по умолчанию {@code ~/.nts-deploy/config.json}) накладывается поверх.
 * Ключи адресуются через точку: {@code backup.auto_backup}.
 */
public class DeployConfig {

    private static final Logger log = LoggerFactory.getLogger(DeployConfig.class);

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final String DEFAULTS_RESOURCE = "/deploy-defaults.json";

    public static final Path DEFAULT_CONFIG_FILE =
            Path.of(System.getProperty("user.home"), ".nts-deploy", "config.json");

    private final ObjectNode root;
    private final Path userFile;  // null - только значения по умолчанию

    private DeployConfig(ObjectNode root, Path userFile) {
        this.root = root;
        this.userFile = userFile;
    }

    /**
     * Только встроенные значения по умолчанию, без пользовательского файла.
     */
    public static DeployConfig defaults() {
        return new DeployConfig(loadDefaults(), null);
    }

    /**
     * Значения по умолчанию + {@link #DEFAULT_CONFIG_FILE}.
     */
    public static DeployConfig load() throws IOException {
        return load(DEFAULT_CONFIG_FILE);
    }

    /**
     * Значения по умолчанию + указанный файл. Отсутствующий файл допустим.
     */
    public static DeployConfig load(Path userFile) throws IOException {
        ObjectNode root = loadDefaults();
        if (Files.isRegularFile(userFile)) {
            JsonNode user = mapper.readTree(userFile.toFile());
            if (user != null && user.isObject()) {
                merge(root, (ObjectNode) user);
            } else {
                log.warn("Ignoring config file {}: top-level value is not an object", userFile);
            }
            log.debug("Loaded deploy configuration from {}", userFile);
        }
        return new DeployConfig(root, userFile);
    }

    public String getString(String key) {
        JsonNode node = lookup(key);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value != null ? value : fallback;
    }

    public boolean getBoolean(String key) {
        return lookup(key).asBoolean(false);
    }

    public int getInt(String key) {
        return lookup(key).asInt(0);
    }

    /**
     * Путь по ключу; ведущая {@code ~} раскрывается в домашнюю директорию пользователя.
     *
     * @throws NtsParamException если ключ не задан
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value == null || value.isBlank()) {
            throw NtsParamException.missing(key);
        }
        if (value.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (value.startsWith("~/") || value.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home"), value.substring(2));
        }
        return Path.of(value);
    }

    /**
     * Устанавливает значение по ключу, создавая промежуточные объекты.
     */
    public void set(String key, Object value) {
        String[] parts = key.split("\\.");
        ObjectNode node = root;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode child = node.get(parts[i]);
            node = child instanceof ObjectNode obj ? obj : node.putObject(parts[i]);
        }
        node.set(parts[parts.length - 1], mapper.valueToTree(value));
    }

    /**
     * Сохраняет текущие значения в пользовательский файл.
     */
    public void save() throws IOException {
        if (userFile == null) {
            throw new IllegalStateException("Configuration has no backing file");
        }
        FileUtils.ensureParentExists(userFile);
        mapper.writeValue(userFile.toFile(), root);
        log.info("Saved deploy configuration to {}", userFile);
    }

    public Path getUserFile() {
        return userFile;
    }

    private JsonNode lookup(String key) {
        JsonNode node = root;
        for (String part : key.split("\\.")) {
            node = node.path(part);
        }
        return node;
    }

    private static ObjectNode loadDefaults() {
        try (InputStream in = DeployConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    // Рекурсивное наложение: объекты сливаются, прочие значения заменяются
    private static void merge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObj && field.getValue() instanceof ObjectNode overlayObj) {
                merge(existingObj, overlayObj);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
