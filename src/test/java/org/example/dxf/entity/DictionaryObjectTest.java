package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.schema.HandleReference;
import org.example.dxf.schema.ReferenceKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.example.dxf.entity.EntityTestSupport.FACTORY;
import static org.example.dxf.entity.EntityTestSupport.export;
import static org.example.dxf.entity.EntityTestSupport.load;

class DictionaryObjectTest {

    private static final String ROOT = """
              0
            DICTIONARY
              5
            C
            330
            0
            100
            AcDbDictionary
            281
            1
              3
            ACAD_GROUP
            350
            D
              3
            ACAD_LAYOUT
            350
            1A
            """;

    @Test
    void load_keepsEntryOrder() {
        DictionaryObject dict = (DictionaryObject) load(ROOT);

        assertThat(dict.entries()).containsExactly(
                entry("ACAD_GROUP", "D"),
                entry("ACAD_LAYOUT", "1A"));
        assertThat(dict.lookup("ACAD_LAYOUT")).contains("1A");
        assertThat(dict.references())
                .extracting(HandleReference::handle, HandleReference::kind)
                .containsExactly(tuple("D", ReferenceKind.SOFT_OWNER), tuple("1A", ReferenceKind.SOFT_OWNER));
    }

    @Test
    void export_roundTrips() {
        assertThat(export(load(ROOT), DxfVersion.R2013)).isEqualTo(ROOT);
    }

    @Test
    void put_hardOwnedDictionary_usesHardOwnerCode() {
        DictionaryObject dict = FACTORY.create("DICTIONARY", DictionaryObject.class);
        dict.set("hard_owned", 1);
        dict.put("MY_DATA", "2F");

        assertThat(dict.references()).extracting(HandleReference::kind).containsExactly(ReferenceKind.HARD_OWNER);
        assertThat(export(dict, DxfVersion.R2013)).contains("  3\nMY_DATA\n360\n2F\n");
    }

    @Test
    void clearReferencesTo_removesEntry() {
        DictionaryObject dict = (DictionaryObject) load(ROOT);

        assertThat(dict.clearReferencesTo("d")).isTrue();

        assertThat(dict.containsKey("ACAD_GROUP")).isFalse();
        assertThat(dict.size()).isEqualTo(1);
    }
}
