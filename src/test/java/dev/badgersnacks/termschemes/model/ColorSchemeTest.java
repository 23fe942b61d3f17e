package dev.badgersnacks.termschemes.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColorSchemeTest {

    @Test
    void settingEntryCopiesDefaultTableInsteadOfMutatingIt() {
        ColorScheme edited = new ColorScheme();
        ColorEntry red = new ColorEntry(RgbColor.of(255, 0, 0), false, true);
        edited.setColorTableEntry(2, red);

        ColorScheme untouched = new ColorScheme();
        assertTrue(edited.hasCustomColorTable());
        assertFalse(untouched.hasCustomColorTable());
        assertEquals(red, edited.colorEntry(2));
        assertEquals(ColorScheme.defaultColorEntry(2), untouched.colorEntry(2));
        assertEquals(ColorScheme.defaultColorEntry(3), edited.colorEntry(3));
    }

    @Test
    void copyConstructorDoesNotShareTables() {
        ColorScheme original = new ColorScheme();
        original.setColorTableEntry(4, ColorEntry.of(1, 2, 3));
        original.setRandomizationRange(4, 10, 0, 0);

        ColorScheme copy = new ColorScheme(original);
        copy.setColorTableEntry(4, ColorEntry.of(9, 9, 9));
        copy.setRandomizationRange(4, 0, 0, 0);

        assertEquals(ColorEntry.of(1, 2, 3), original.colorEntry(4));
        assertEquals(new RandomizationRange(10, 0, 0), original.randomizationRange(4));
    }

    @Test
    void sameSeedProducesSamePalette() {
        ColorScheme scheme = randomizedScheme();
        assertArrayEquals(scheme.getColorTable(42), scheme.getColorTable(42));
        assertArrayEquals(scheme.getColorTable(-7), new ColorScheme(scheme).getColorTable(-7));
    }

    @Test
    void schemeWithoutRandomizationIgnoresSeed() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(5, ColorEntry.of(10, 20, 30));
        ColorEntry[] base = scheme.getColorTable(0);
        for (int seed = 1; seed < 50; seed++) {
            assertArrayEquals(base, scheme.getColorTable(seed));
        }
        assertEquals(ColorEntry.of(10, 20, 30), base[5]);
        assertEquals(ColorScheme.defaultColorEntry(6), base[6]);
    }

    @Test
    void zeroSeedReturnsActiveTableUnchanged() {
        ColorScheme scheme = randomizedScheme();
        ColorEntry[] table = scheme.getColorTable(0);
        assertEquals(RgbColor.of(255, 0, 0), table[2].color());
        assertEquals(RgbColor.of(0, 0, 200), table[3].color());
    }

    @Test
    void hueJitterStaysWithinRangeAndVaries() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(2, ColorEntry.of(255, 0, 0));
        scheme.setRandomizationRange(2, 30, 0, 0);

        Set<Integer> hues = new HashSet<>();
        for (int seed = 1; seed <= 500; seed++) {
            int hue = scheme.colorEntry(2, seed).color().toHsv().hue();
            int distance = Math.min(hue, 360 - hue);
            assertTrue(distance <= 31, "hue " + hue + " drifted too far for seed " + seed);
            hues.add(hue);
        }
        assertTrue(hues.size() > 10, "expected visible variation, got " + hues);
        assertTrue(hues.stream().anyMatch(hue -> hue > 300), "expected hues wrapping below 0");
    }

    @Test
    void differentSeedsGiveDifferentPalettes() {
        ColorScheme scheme = randomizedScheme();
        List<ColorEntry> slotTwo = new ArrayList<>();
        for (int seed = 1; seed <= 20; seed++) {
            slotTwo.add(scheme.colorEntry(2, seed));
        }
        assertTrue(new HashSet<>(slotTwo).size() > 1);
    }

    @Test
    void saturationAndValueAreClampedToChannelRange() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(4, ColorEntry.of(250, 10, 10));
        scheme.setRandomizationRange(4, 0, 255, 255);
        for (int seed = 1; seed <= 200; seed++) {
            HsvColor hsv = scheme.colorEntry(4, seed).color().toHsv();
            assertTrue(hsv.saturation() >= 0 && hsv.saturation() <= 255);
            assertTrue(hsv.value() >= 0 && hsv.value() <= 255);
        }
    }

    @Test
    void randomizationKeepsTransparencyAndBold() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(7, new ColorEntry(RgbColor.of(20, 200, 90), true, true));
        scheme.setRandomizationRange(7, 90, 40, 40);
        for (int seed = 1; seed <= 50; seed++) {
            ColorEntry entry = scheme.colorEntry(7, seed);
            assertTrue(entry.transparent());
            assertTrue(entry.bold());
        }
    }

    @Test
    void backgroundIsExemptUnlessBackgroundRandomizationEnabled() {
        ColorScheme scheme = new ColorScheme();
        ColorEntry background = ColorEntry.of(200, 30, 30);
        scheme.setColorTableEntry(ColorScheme.BACKGROUND_INDEX, background);
        scheme.setRandomizationRange(ColorScheme.BACKGROUND_INDEX, 120, 0, 0);
        for (int seed = 1; seed <= 50; seed++) {
            assertEquals(background, scheme.colorEntry(ColorScheme.BACKGROUND_INDEX, seed));
        }

        scheme.setRandomizedBackgroundColor(true);
        assertTrue(scheme.randomizedBackgroundColor());
        assertEquals(new RandomizationRange(340, 255, 0), scheme.randomizationRange(ColorScheme.BACKGROUND_INDEX));
        boolean changed = false;
        for (int seed = 1; seed <= 50; seed++) {
            changed |= !background.equals(scheme.colorEntry(ColorScheme.BACKGROUND_INDEX, seed));
        }
        assertTrue(changed);

        scheme.setRandomizedBackgroundColor(false);
        assertTrue(scheme.randomizationRange(ColorScheme.BACKGROUND_INDEX).isNull());
    }

    @Test
    void colorEntryMatchesTableSlot() {
        ColorScheme scheme = randomizedScheme();
        ColorEntry[] table = new ColorEntry[ColorScheme.TABLE_COLORS];
        scheme.getColorTable(table, 99);
        for (int i = 0; i < ColorScheme.TABLE_COLORS; i++) {
            assertEquals(table[i], scheme.colorEntry(i, 99));
        }
    }

    @Test
    void foregroundAndBackgroundIgnoreRandomization() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(ColorScheme.BACKGROUND_INDEX, ColorEntry.of(1, 2, 3));
        scheme.setColorTableEntry(ColorScheme.FOREGROUND_INDEX, ColorEntry.of(200, 100, 50));
        scheme.setRandomizationRange(ColorScheme.FOREGROUND_INDEX, 100, 100, 100);

        assertEquals(RgbColor.of(1, 2, 3), scheme.backgroundColor());
        assertEquals(RgbColor.of(200, 100, 50), scheme.foregroundColor());
    }

    @Test
    void darkBackgroundUsesFixedThreshold() {
        assertTrue(withBackground(50).hasDarkBackground());
        assertFalse(withBackground(200).hasDarkBackground());
        assertTrue(withBackground(126).hasDarkBackground());
        assertFalse(withBackground(127).hasDarkBackground());
        assertFalse(new ColorScheme().hasDarkBackground());
    }

    @Test
    void zeroRangeDoesNotAllocateRandomization() {
        ColorScheme scheme = new ColorScheme();
        scheme.setRandomizationRange(3, 0, 0, 0);
        assertFalse(scheme.hasRandomization());

        scheme.setRandomizationRange(3, 15, 0, 0);
        assertTrue(scheme.hasRandomization());
        scheme.setRandomizationRange(3, 0, 0, 0);
        assertFalse(scheme.hasRandomization());
        assertEquals(RandomizationRange.NONE, scheme.randomizationRange(3));
    }

    @Test
    void rejectsOutOfRangeArguments() {
        ColorScheme scheme = new ColorScheme();
        assertThrows(IndexOutOfBoundsException.class, () -> scheme.setColorTableEntry(20, ColorEntry.of(0, 0, 0)));
        assertThrows(IndexOutOfBoundsException.class, () -> scheme.colorEntry(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> ColorScheme.colorNameForIndex(ColorScheme.TABLE_COLORS));
        assertThrows(IllegalArgumentException.class, () -> scheme.setRandomizationRange(2, 341, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> scheme.setOpacity(1.5));
        assertThrows(IllegalArgumentException.class, () -> scheme.getColorTable(new ColorEntry[3], 0));
    }

    @Test
    void mutationsNotifyListener() {
        ColorScheme scheme = new ColorScheme();
        List<ColorScheme> notified = new ArrayList<>();
        scheme.setModificationListener(notified::add);

        scheme.setOpacity(0.5);
        scheme.setColorTableEntry(2, ColorEntry.of(1, 1, 1));
        scheme.setRandomizationRange(2, 5, 5, 5);
        scheme.setName("renamed");

        assertEquals(3, notified.size());
        assertTrue(notified.stream().allMatch(s -> s == scheme));
    }

    @Test
    void slotNamesFollowTableLayout() {
        assertEquals("Background", ColorScheme.colorNameForIndex(0));
        assertEquals("Foreground", ColorScheme.colorNameForIndex(1));
        assertEquals("Color0", ColorScheme.colorNameForIndex(2));
        assertEquals("ForegroundIntense", ColorScheme.colorNameForIndex(11));
        assertEquals("Color7Intense", ColorScheme.colorNameForIndex(19));
        assertEquals("Color 8 (Intense)", ColorScheme.translatedColorNameForIndex(19));
        assertNotEquals(ColorScheme.colorNameForIndex(10), ColorScheme.colorNameForIndex(0));
    }

    private static ColorScheme withBackground(int gray) {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(ColorScheme.BACKGROUND_INDEX, ColorEntry.of(gray, gray, gray));
        return scheme;
    }

    private static ColorScheme randomizedScheme() {
        ColorScheme scheme = new ColorScheme();
        scheme.setColorTableEntry(2, ColorEntry.of(255, 0, 0));
        scheme.setColorTableEntry(3, ColorEntry.of(0, 0, 200));
        scheme.setRandomizationRange(2, 60, 40, 40);
        scheme.setRandomizationRange(3, 20, 0, 30);
        return scheme;
    }
}
