package com.example.musicstreaming.infrastructure.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DashManifestParserTest {

    private static final String DUAL_MANIFEST = "<?xml version=\"1.0\"?>\n"
            + "<MPD xmlns=\"urn:mpeg:dash:schema:mpd:2011\" type=\"static\">\n"
            + "  <Period>\n"
            + "    <AdaptationSet id=\"0\" contentType=\"audio\">\n"
            + "      <Representation id=\"0\" bandwidth=\"320000\">\n"
            + "        <SegmentTemplate initialization=\"init-$RepresentationID$.m4s\">\n"
            + "          <SegmentTimeline>\n"
            + "            <S t=\"0\" d=\"192000\" r=\"4\"/>\n"
            + "            <S d=\"96000\"/>\n"
            + "          </SegmentTimeline>\n"
            + "        </SegmentTemplate>\n"
            + "      </Representation>\n"
            + "      <Representation id=\"1\" bandwidth=\"96000\">\n"
            + "        <SegmentTemplate>\n"
            + "          <SegmentTimeline>\n"
            + "            <S t=\"0\" d=\"192000\" r=\"1\"/>\n"
            + "          </SegmentTimeline>\n"
            + "        </SegmentTemplate>\n"
            + "      </Representation>\n"
            + "    </AdaptationSet>\n"
            + "  </Period>\n"
            + "</MPD>\n";

    @Test
    void shouldCountRepeatedTimelineEntries() {
        Map<String, Integer> counts = DashManifestParser.countTimelineSegments(DUAL_MANIFEST, null);

        Assertions.assertEquals(Integer.valueOf(6), counts.get("0"));
        Assertions.assertEquals(Integer.valueOf(2), counts.get("1"));
        Assertions.assertEquals(Arrays.asList("0", "1"), Arrays.asList(counts.keySet().toArray(new String[0])));
    }

    @Test
    void shouldReportOnlyRequestedRepresentations() {
        Map<String, Integer> counts = DashManifestParser.countTimelineSegments(DUAL_MANIFEST,
                Collections.singletonList("1"));

        Assertions.assertEquals(1, counts.size());
        Assertions.assertEquals(Integer.valueOf(2), counts.get("1"));
    }

    @Test
    void shouldInheritTemplateFromAdaptationSet() {
        String manifest = "<MPD><Period><AdaptationSet>"
                + "<SegmentTemplate><SegmentTimeline><S d=\"10\" r=\"2\"/></SegmentTimeline></SegmentTemplate>"
                + "<Representation id=\"0\"/>"
                + "</AdaptationSet></Period></MPD>";

        Assertions.assertEquals(Integer.valueOf(3),
                DashManifestParser.countTimelineSegments(manifest, null).get("0"));
    }

    @Test
    void shouldCountZeroWithoutTimeline() {
        String manifest = "<MPD><Period><AdaptationSet>"
                + "<Representation id=\"0\"><SegmentTemplate duration=\"4\"/></Representation>"
                + "<Representation id=\"1\"/>"
                + "</AdaptationSet></Period></MPD>";

        Map<String, Integer> counts = DashManifestParser.countTimelineSegments(manifest, null);
        Assertions.assertEquals(Integer.valueOf(0), counts.get("0"));
        Assertions.assertEquals(Integer.valueOf(0), counts.get("1"));
    }

    @Test
    void shouldTreatNegativeOrGarbageRepeatAsSingleEntry() {
        String manifest = "<MPD><Period><AdaptationSet><Representation id=\"0\"><SegmentTemplate><SegmentTimeline>"
                + "<S d=\"10\" r=\"-1\"/><S d=\"10\" r=\"x\"/>"
                + "</SegmentTimeline></SegmentTemplate></Representation></AdaptationSet></Period></MPD>";

        Assertions.assertEquals(Integer.valueOf(2),
                DashManifestParser.countTimelineSegments(manifest, null).get("0"));
    }

    @Test
    void shouldRejectMalformedOrEmptyDocuments() {
        Assertions.assertThrows(DashManifestParser.ManifestParseException.class,
                () -> DashManifestParser.countTimelineSegments("<MPD><Period>", null));
        Assertions.assertThrows(DashManifestParser.ManifestParseException.class,
                () -> DashManifestParser.countTimelineSegments("  ", null));
    }

    @Test
    void shouldRejectDoctypeDeclarations() {
        String manifest = "<?xml version=\"1.0\"?><!DOCTYPE MPD [<!ENTITY x \"y\">]><MPD/>";

        Assertions.assertThrows(DashManifestParser.ManifestParseException.class,
                () -> DashManifestParser.countTimelineSegments(manifest, null));
    }
}
