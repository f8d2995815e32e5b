package com.fisheye.vision.service;

import com.fisheye.vision.config.YamlConfig;
import com.fisheye.vision.core.storage.ArtifactStorage;
import com.fisheye.vision.core.storage.StorageUri;
import com.fisheye.vision.exception.ArtifactNotFoundException;
import com.fisheye.vision.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提示词版本库
 * <p>
 * 提示词以 prompts/prompt_{name}_{version}.txt 保存在存储中，例如：
 * - prompts/prompt_default_0.txt  name=default, version=0
 * - prompts/prompt_lobby_2.txt    name=lobby, version=2
 * <p>
 * 存储中没有的版本回退到 classpath 内置的 prompts/ 目录；
 * 新版本只写入存储，内置提示词只读
 */
@Service
public class PromptLibraryService {
    private static final Logger logger = LoggerFactory.getLogger(PromptLibraryService.class);

    static final String PROMPTS_DIR = "prompts/";
    static final String SOURCE_STORAGE = "storage";
    static final String SOURCE_BUNDLED = "bundled";

    private static final Pattern FILE_PATTERN = Pattern.compile("^prompt_(.+)_(\\d+)\\.txt$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");

    private final ArtifactStorage storage;
    private final StorageUri location;
    private final String defaultName;
    private final Map<String, Map<Integer, Resource>> bundled;

    public PromptLibraryService(ArtifactStorage storage, YamlConfig config) {
        this.storage = storage;
        this.location = StorageUri.parsePrefix(config.getPrompts().getLocation());
        this.defaultName = config.getPrompts().getDefaultName();
        this.bundled = scanBundled();
        logger.info("Prompt library at {} with {} bundled prompt names", location, bundled.size());
    }

    /**
     * 所有提示词的所有版本；同一版本在存储中存在时以存储为准，其余版本标记为内置
     */
    public List<Map<String, Object>> listPrompts() {
        Map<String, TreeSet<Integer>> stored = listStored();
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map.Entry<String, TreeSet<Integer>> entry : merge(stored).entrySet()) {
            String name = entry.getKey();
            TreeSet<Integer> storedVersions = stored.get(name);
            int latest = entry.getValue().last();
            for (Integer version : entry.getValue()) {
                boolean inStorage = storedVersions != null && storedVersions.contains(version);
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", name);
                item.put("version", version);
                item.put("latest", version == latest);
                item.put("source", inStorage ? SOURCE_STORAGE : SOURCE_BUNDLED);
                result.add(item);
            }
        }
        return result;
    }

    /**
     * 每个提示词名称及其最新版本
     */
    public List<Map<String, Object>> getPromptNames() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map.Entry<String, TreeSet<Integer>> entry : mergedVersions().entrySet()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", entry.getKey());
            item.put("latest_version", entry.getValue().last());
            item.put("version_count", entry.getValue().size());
            result.add(item);
        }
        return result;
    }

    /**
     * @param version 为 null 时取最新版本
     * @throws ArtifactNotFoundException 名称或版本不存在
     */
    public String getPrompt(String name, Integer version) {
        Map<String, TreeSet<Integer>> stored = listStored();
        TreeSet<Integer> versions = merge(stored).get(name);
        if (versions == null) {
            throw new ArtifactNotFoundException("prompt " + name);
        }
        int resolved = version != null ? version : versions.last();
        if (!versions.contains(resolved)) {
            throw new ArtifactNotFoundException("prompt " + name + " v" + resolved);
        }
        if (stored.containsKey(name) && stored.get(name).contains(resolved)) {
            return storage.getText(promptUri(name, resolved).toString());
        }
        return readBundled(name, resolved);
    }

    public String getDefaultPrompt() {
        return getPrompt(defaultName, null);
    }

    /**
     * 名称已存在时推送新版本，否则创建版本 0
     *
     * @return action (pushed / created)、name、version、uri，推送时附带 previous_version
     */
    public Map<String, Object> save(String name, String content) {
        if (name == null || name.isBlank() || content == null || content.isBlank()) {
            throw new ValidationException("Missing required fields: name, content");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException("Invalid prompt name: " + name
                    + ". Must start with a letter and contain only alphanumeric characters and underscores.");
        }
        TreeSet<Integer> versions = mergedVersions().get(name);
        Map<String, Object> result = new LinkedHashMap<>();
        int version;
        if (versions == null) {
            version = 0;
            result.put("action", "created");
        } else {
            version = versions.last() + 1;
            result.put("action", "pushed");
        }
        String uri = storage.putText(content, promptUri(name, version).toString());
        result.put("name", name);
        result.put("version", version);
        if (versions != null) {
            result.put("previous_version", versions.last());
        }
        result.put("uri", uri);
        logger.info("Prompt {} v{} {} at {}", name, version, result.get("action"), uri);
        return result;
    }

    private Map<String, TreeSet<Integer>> mergedVersions() {
        return merge(listStored());
    }

    private Map<String, TreeSet<Integer>> merge(Map<String, TreeSet<Integer>> stored) {
        Map<String, TreeSet<Integer>> merged = new TreeMap<>();
        for (Map.Entry<String, Map<Integer, Resource>> entry : bundled.entrySet()) {
            merged.put(entry.getKey(), new TreeSet<>(entry.getValue().keySet()));
        }
        for (Map.Entry<String, TreeSet<Integer>> entry : stored.entrySet()) {
            merged.computeIfAbsent(entry.getKey(), k -> new TreeSet<>()).addAll(entry.getValue());
        }
        return merged;
    }

    private Map<String, TreeSet<Integer>> listStored() {
        Map<String, TreeSet<Integer>> prompts = new TreeMap<>();
        for (String uri : storage.list(location.resolve(PROMPTS_DIR + "prompt_").toString())) {
            String fileName = uri.substring(uri.lastIndexOf('/') + 1);
            Matcher matcher = FILE_PATTERN.matcher(fileName);
            if (matcher.matches()) {
                prompts.computeIfAbsent(matcher.group(1), k -> new TreeSet<>())
                        .add(Integer.parseInt(matcher.group(2)));
            }
        }
        return prompts;
    }

    private StorageUri promptUri(String name, int version) {
        return location.resolve(PROMPTS_DIR + "prompt_" + name + "_" + version + ".txt");
    }

    private String readBundled(String name, int version) {
        Resource resource = bundled.get(name).get(version);
        try {
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled prompt " + name + " v" + version, e);
        }
    }

    private static Map<String, Map<Integer, Resource>> scanBundled() {
        Map<String, Map<Integer, Resource>> prompts = new TreeMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver()
                    .getResources("classpath*:" + PROMPTS_DIR + "prompt_*.txt");
            for (Resource resource : resources) {
                String fileName = resource.getFilename();
                Matcher matcher = fileName == null ? null : FILE_PATTERN.matcher(fileName);
                if (matcher != null && matcher.matches()) {
                    prompts.computeIfAbsent(matcher.group(1), k -> new TreeMap<>())
                            .put(Integer.parseInt(matcher.group(2)), resource);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to scan bundled prompts: {}", e.getMessage());
        }
        return prompts;
    }
}
