package com.example.pdfoutline.batch;

import com.example.pdfoutline.model.DocumentOutline;
import com.example.pdfoutline.service.OutlineExtractionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts every PDF of an input directory into a {@code <name>.json} outline in an output directory.
 * Runs at startup when {@code pdf.outline.batch.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "pdf.outline.batch", name = "enabled", havingValue = "true")
public class OutlineBatchRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(OutlineBatchRunner.class);

    private final OutlineExtractionService outlineExtractionService;
    private final ObjectMapper writer;

    @Value("${pdf.outline.batch.input-dir:input}")
    private String inputDir;

    @Value("${pdf.outline.batch.output-dir:output}")
    private String outputDir;

    public OutlineBatchRunner(OutlineExtractionService outlineExtractionService, ObjectMapper objectMapper) {
        this.outlineExtractionService = outlineExtractionService;
        this.writer = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        runBatch();
    }

    /**
     * @return number of outlines written
     */
    public int runBatch() throws IOException {
        Path input = Paths.get(inputDir);
        Path output = Paths.get(outputDir);

        if (!Files.isDirectory(input)) {
            Files.createDirectories(input);
            logger.info("Created input directory at {}. Please add your PDF files there.", input.toAbsolutePath());
            return 0;
        }
        Files.createDirectories(output);

        List<Path> pdfFiles;
        try (Stream<Path> files = Files.list(input)) {
            pdfFiles = files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        logger.info("Found {} PDF(s) in {}", pdfFiles.size(), input.toAbsolutePath());

        int written = 0;
        for (Path pdf : pdfFiles) {
            String fileName = pdf.getFileName().toString();
            logger.info("Processing {}...", fileName);
            try {
                DocumentOutline outline = outlineExtractionService.extract(pdf);
                Path target = output.resolve(fileName.substring(0, fileName.lastIndexOf('.')) + ".json");
                try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                    writer.writeValue(out, outline);
                }
                written++;
                logger.info("Successfully created {}", target);
            } catch (Exception e) {
                logger.error("Failed to process {}: {}", fileName, e.getMessage(), e);
            }
        }
        logger.info("Batch finished: {} of {} file(s) converted", written, pdfFiles.size());
        return written;
    }
}
