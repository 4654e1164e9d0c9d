/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.xnatworks.cbct.error.ArtifactNotFoundException;
import io.xnatworks.cbct.error.MalformedConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code _Frames.xml}: {@code FrameData/Treatment/ID} and the {@code FrameData/Image}
 * block ({@code AcquisitionPresetName}, {@code DicomUID}, {@code kV}, {@code mA}).
 * The preset may be written as a child element or as an attribute of {@code Image}.
 */
public class FramesMetadataParser {
    private static final Logger log = LoggerFactory.getLogger(FramesMetadataParser.class);

    private final XmlMapper xmlMapper = new XmlMapper();

    public FramesMetadata parse(Path framesFile) throws ArtifactNotFoundException, MalformedConfigException {
        if (!Files.isRegularFile(framesFile)) {
            throw new ArtifactNotFoundException("Frame metadata not found: " + framesFile);
        }
        JsonNode root;
        try {
            root = xmlMapper.readTree(framesFile.toFile());
        } catch (IOException e) {
            throw new MalformedConfigException("Unparseable frame metadata " + framesFile.getFileName()
                    + ": " + e.getMessage(), e);
        }
        return fromTree(root, framesFile);
    }

    public FramesMetadata parse(String xml) throws MalformedConfigException {
        try {
            return fromTree(xmlMapper.readTree(xml), null);
        } catch (IOException e) {
            throw new MalformedConfigException("Unparseable frame metadata: " + e.getMessage(), e);
        }
    }

    private FramesMetadata fromTree(JsonNode root, Path source) {
        if (root == null || root.isMissingNode()) {
            return new FramesMetadata(null, null, null, null, null);
        }
        JsonNode treatment = root.path("Treatment");
        JsonNode image = root.path("Image");

        String treatmentId = text(treatment.path("ID"));
        if (treatmentId == null) {
            log.warn("No Treatment/ID in {}", source != null ? source : "frame metadata");
        }
        String preset = text(image.path("AcquisitionPresetName"));
        String dicomUid = text(image.path("DicomUID"));
        Double kv = number(image.path("kV"), "kV", source);
        Double ma = number(image.path("mA"), "mA", source);

        return new FramesMetadata(treatmentId, preset, dicomUid, kv, ma);
    }

    /**
     * Text of an element, attribute or element-with-attributes node. Blank is treated as absent.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.size() == 0 ? null : text(node.get(0));
        }
        if (node.isObject()) {
            // Element with attributes: character data is exposed under the empty name
            return text(node.path(""));
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static Double number(JsonNode node, String name, Path source) {
        String value = text(node);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {} '{}' in {}", name, value, source != null ? source : "frame metadata");
            return null;
        }
    }
}
