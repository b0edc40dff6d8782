package com.starscape.rapidvariant.features.runpipeline.app;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.finalizemedia.domain.DescriptiveFields;
import com.starscape.rapidvariant.features.generatevariants.domain.FileConstraints;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;

/**
 * Checks a submission before any decoding or network work: size, declared type,
 * sniffed content type, required descriptive fields.
 */
@Component
public class FileValidator {
    
    private static final Logger log = LoggerFactory.getLogger(FileValidator.class);
    
    /**
     * @throws PipelineException VALIDATION_ERROR describing the first violation
     */
    public void validate(SourceImage source, DescriptiveFields fields, FileConstraints constraints) {
        if (source.sizeBytes() == 0) {
            throw PipelineException.validation("File " + source.filename() + " is empty", "The selected file is empty.");
        }
        if (source.sizeBytes() > constraints.maxSizeBytes()) {
            throw PipelineException.validation(
                "File " + source.filename() + " is " + source.sizeBytes() + " bytes, limit is " + constraints.maxSizeBytes(),
                "File is too large. Maximum size is " + constraints.maxSizeMegabytes() + "MB.");
        }
        if (!constraints.isSupported(source.mimeType())) {
            throw PipelineException.validation(
                "Unsupported MIME type " + source.mimeType(),
                "Unsupported file type. Please upload a JPEG, PNG, WebP, or GIF image.");
        }
        
        String sniffed = sniff(source);
        if (sniffed == null || !constraints.isSupported(sniffed)) {
            throw PipelineException.validation(
                "Content of " + source.filename() + " is not a supported image (detected " + sniffed + ")",
                "The file content is not a supported image.");
        }
        if (!sniffed.equalsIgnoreCase(source.mimeType())) {
            log.debug("Declared type {} differs from detected {} for {}", source.mimeType(), sniffed, source.filename());
        }
        
        if (fields.name() == null) {
            throw PipelineException.validation("Name is required", "Please enter a name for the image.");
        }
        if (fields.altText() == null) {
            throw PipelineException.validation("Alt text is required", "Please enter alt text for the image.");
        }
    }
    
    private String sniff(SourceImage source) {
        try (BufferedInputStream in = new BufferedInputStream(source.openStream())) {
            FileType type = FileTypeDetector.detectFileType(in);
            return type == FileType.Unknown ? null : type.getMimeType();
        } catch (IOException e) {
            throw PipelineException.validation("Could not read " + source.filename() + ": " + e.getMessage(),
                "The file could not be read.");
        }
    }
}
