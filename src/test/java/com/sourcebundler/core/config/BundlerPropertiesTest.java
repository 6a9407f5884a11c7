package com.sourcebundler.core.config;

import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BundlerPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new BundlerProperties();
        assertEquals(ExtensionSet.of(".py", ".rs", ".c", ".h", ".cpp", ".hpp", ".css"), props.extensionSet());
        assertFalse(props.isOverwrite());
        assertTrue(props.filterRules().isEmpty());
        assertEquals(List.of("UTF-8", "windows-1252", "ISO-8859-1"), props.getEncodings());
        assertEquals(8192, props.getBinary().getSampleSize());
        assertEquals(0.10, props.getBinary().getMaxNonPrintableRatio());
        assertEquals(10_000, props.getSplit().getMaxRenameAttempts());
        assertEquals(1_000, props.getSplit().getMaxErrorBlockLines());
        assertEquals(100, props.getSplit().getProgressStride());
    }

    @Test
    void bindsFromKebabCaseKeys() {
        var source = new MapConfigurationPropertySource(Map.of(
                "bundler.extensions[0]", "java",
                "bundler.extensions[1]", ".KT",
                "bundler.overwrite", "true",
                "bundler.filters[0].pattern", "build",
                "bundler.filters[1].pattern", "*.gen.py",
                "bundler.filters[1].active", "false",
                "bundler.binary.max-non-printable-ratio", "0.25",
                "bundler.split.max-rename-attempts", "5"
        ));
        BundlerProperties props = new Binder(source).bind("bundler", BundlerProperties.class).get();

        assertEquals(ExtensionSet.of(".java", ".kt"), props.extensionSet());
        assertTrue(props.isOverwrite());
        assertEquals(List.of(FilterRule.of("build"), new FilterRule("*.gen.py", false)), props.filterRules());
        assertEquals(0.25, props.getBinary().getMaxNonPrintableRatio());
        assertEquals(5, props.getSplit().getMaxRenameAttempts());
    }
}
