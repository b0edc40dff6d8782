package com.starscape.rapidvariant.features.uploadvariants.domain;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class UploadNamingTest {
    
    @Test
    void baseNameIsLowerCaseSlug() {
        assertEquals("sunset-over-the-lake", UploadNaming.baseName("Sunset over  the Lake!"));
        assertEquals("img-2041", UploadNaming.baseName("IMG_2041"));
        assertEquals("already-slugged", UploadNaming.baseName("--already--slugged--"));
    }
    
    @Test
    void baseNameFallsBackWhenNothingUsableRemains() {
        assertEquals("image", UploadNaming.baseName(null));
        assertEquals("image", UploadNaming.baseName("   "));
        assertEquals("image", UploadNaming.baseName("!!!"));
    }
    
    @Test
    void baseNameIsCapped() {
        String slug = UploadNaming.baseName("a".repeat(49) + " tail of the name");
        
        assertTrue(slug.length() <= UploadNaming.MAX_BASE_NAME_LENGTH);
        assertFalse(slug.endsWith("-"));
    }
    
    @Test
    void uploadIdStartsWithClockMillis() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        
        String first = UploadNaming.newUploadId(clock);
        String second = UploadNaming.newUploadId(clock);
        
        assertTrue(first.matches("1700000000000-[a-z0-9]{8}"), first);
        assertNotEquals(first, second);
    }
    
    @Test
    void objectKeyOmitsSuffixForOriginal() {
        UploadMetadata original = metadata("original", "png");
        UploadMetadata medium = metadata("md", "webp");
        
        assertEquals("media/sunset-1700000000000-abcd1234.png", UploadNaming.objectKey("media/", original));
        assertEquals("media/sunset-md-1700000000000-abcd1234.webp", UploadNaming.objectKey("media", medium));
        assertEquals("sunset-md-1700000000000-abcd1234.webp", UploadNaming.objectKey("", medium));
    }
    
    private static UploadMetadata metadata(String variant, String extension) {
        return new UploadMetadata("sunset", "1700000000000-abcd1234", variant, 100, 50, "image/" + extension, extension);
    }
}
