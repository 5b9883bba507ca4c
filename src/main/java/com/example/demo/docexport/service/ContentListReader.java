package com.example.demo.docexport.service;

import com.example.demo.docexport.exception.InvalidContentListException;
import com.example.demo.docexport.model.BlockType;
import com.example.demo.docexport.model.CodeBlock;
import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.EquationBlock;
import com.example.demo.docexport.model.IgnoredBlock;
import com.example.demo.docexport.model.ImageBlock;
import com.example.demo.docexport.model.ListBlock;
import com.example.demo.docexport.model.TableBlock;
import com.example.demo.docexport.model.TextBlock;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the extraction pipeline's {@code *_content_list.json} into content
 * blocks. Entries of an unknown type are kept as {@link IgnoredBlock}s.
 */
@Slf4j
@Component
public class ContentListReader {
    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<ContentBlock> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new InvalidContentListException("Cannot read content list " + file, e);
        }
    }

    public List<ContentBlock> read(InputStream in) {
        try {
            return toBlocks(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new InvalidContentListException("Content list is not valid JSON", e);
        }
    }

    public List<ContentBlock> read(String json) {
        try {
            return toBlocks(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidContentListException("Content list is not valid JSON", e);
        }
    }

    private List<ContentBlock> toBlocks(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new InvalidContentListException("Content list must be a JSON array");
        }
        List<ContentBlock> blocks = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            blocks.add(toBlock(entry));
        }
        log.debug("Read {} content blocks", blocks.size());
        return blocks;
    }

    ContentBlock toBlock(JsonNode entry) {
        String type = text(entry, "type");
        switch (BlockType.fromWireName(type)) {
            case TEXT:
                return TextBlock.builder()
                        .text(textOrEmpty(entry, "text"))
                        .level(entry.hasNonNull("text_level") ? entry.get("text_level").asInt() : null)
                        .build();
            case EQUATION:
                return EquationBlock.of(textOrEmpty(entry, "text"));
            case LIST:
                return ListBlock.of(strings(entry, "list_items"));
            case IMAGE:
                return ImageBlock.builder()
                        .path(text(entry, "img_path"))
                        .captions(strings(entry, "image_caption"))
                        .build();
            case TABLE:
                return TableBlock.builder()
                        .htmlBody(text(entry, "table_body"))
                        .path(text(entry, "img_path"))
                        .captions(strings(entry, "table_caption"))
                        .build();
            case CODE:
                return CodeBlock.builder()
                        .body(textOrEmpty(entry, "code_body"))
                        .language(text(entry, "guess_lang"))
                        .captions(strings(entry, "code_caption"))
                        .build();
            default:
                return new IgnoredBlock(type);
        }
    }

    private static String text(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String textOrEmpty(JsonNode entry, String field) {
        String value = text(entry, field);
        return value == null ? "" : value;
    }

    /**
     * A string array field; a lone string counts as a one-element array.
     */
    private static List<String> strings(JsonNode entry, String field) {
        List<String> values = new ArrayList<>();
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isNull()) {
                    values.add(item.asText());
                }
            }
        } else {
            values.add(node.asText());
        }
        return values;
    }
}
