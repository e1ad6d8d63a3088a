package org.example.dxf.db;

import org.example.dxf.DuplicateHandleException;
import org.example.dxf.DxfDocument;
import org.example.dxf.DxfOptions;
import org.example.dxf.ProtectedEntityException;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.EntityFactory;
import org.example.dxf.entity.Polyline;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityDatabaseTest {

    private final EntityFactory factory = new EntityFactory(DxfOptions.defaults());

    @Test
    void register_assignsHandleWhenMissing() {
        EntityDatabase db = new EntityDatabase(HandleGenerator.fromSeed("20"));
        DxfEntity line = factory.create("LINE");

        String handle = db.register(line);

        assertThat(handle).isEqualTo("20");
        assertThat(line.handle()).isEqualTo("20");
        assertThat(db.resolve("20")).containsSame(line);
        assertThat(db.resolve("20".toLowerCase())).containsSame(line);
    }

    @Test
    void register_keepsExistingHandleAndSkipsItLater() {
        EntityDatabase db = new EntityDatabase();
        DxfEntity first = factory.create("LINE");
        first.assignHandle("1");

        db.register(first);
        String generated = db.register(factory.create("CIRCLE"));

        assertThat(generated).isEqualTo("2");
    }

    @Test
    void register_duplicateHandle_throws() {
        EntityDatabase db = new EntityDatabase();
        DxfEntity a = factory.create("LINE");
        a.assignHandle("A0");
        DxfEntity b = factory.create("LINE");
        b.assignHandle("a0");
        db.register(a);

        assertThatThrownBy(() -> db.register(b)).isInstanceOf(DuplicateHandleException.class);
        assertThat(db.resolve("A0")).containsSame(a);
    }

    @Test
    void register_sameInstanceTwice_isNoOp() {
        EntityDatabase db = new EntityDatabase();
        DxfEntity line = factory.create("LINE");

        String handle = db.register(line);

        assertThat(db.register(line)).isEqualTo(handle);
        assertThat(db.size()).isEqualTo(1);
    }

    @Test
    void resolve_nullAndZeroHandles_areEmpty() {
        EntityDatabase db = new EntityDatabase();

        assertThat(db.resolve(null)).isEmpty();
        assertThat(db.resolve("0")).isEmpty();
        assertThat(db.resolve("")).isEmpty();
        assertThat(db.resolve("FFFF")).isEmpty();
    }

    @Test
    void setOwner_replacesPreviousOwner() {
        EntityDatabase db = new EntityDatabase();
        DxfEntity line = factory.create("LINE");
        db.register(line);

        db.setOwner(line, "1F");
        db.setOwner(line, "2F");

        assertThat(line.owner()).isEqualTo("2F");
    }

    @Test
    void purge_hardReferenceBlocksDeletionUntilCleared() {
        DxfDocument doc = DxfDocument.create();
        BlockRecord msp = doc.modelspace();
        DxfEntity line = doc.add(msp, "LINE");
        DxfEntity circle = doc.add(msp, "CIRCLE");
        circle.set("material_handle", line.handle());

        assertThatThrownBy(() -> doc.delete(line))
                .isInstanceOf(ProtectedEntityException.class)
                .satisfies(e -> assertThat(((ProtectedEntityException) e).getReferrers())
                        .containsExactly(circle.handle()));
        assertThat(line.isAlive()).isTrue();
        assertThat(msp.entities()).contains(line);
        assertThat(doc.database().resolve(line.handle())).containsSame(line);

        circle.clearReferencesTo(line.handle());
        doc.delete(line);

        assertThat(line.isAlive()).isFalse();
        assertThat(msp.entities()).doesNotContain(line);
        assertThat(doc.database().resolve(line.handle())).isEmpty();
    }

    @Test
    void purge_softReferenceDoesNotProtect() {
        DxfDocument doc = DxfDocument.create();
        DxfEntity line = doc.add(doc.modelspace(), "LINE");
        DxfEntity circle = doc.add(doc.modelspace(), "CIRCLE");
        circle.reactors().add(line.handle());

        doc.delete(line);

        assertThat(doc.database().resolve(line.handle())).isEmpty();
        assertThat(doc.database().resolve(circle.reactors().get(0))).isEmpty();
    }

    @Test
    void purge_removesSubEntitiesWithParent() {
        DxfDocument doc = DxfDocument.create();
        Polyline polyline = (Polyline) doc.add(doc.modelspace(), "POLYLINE");
        DxfEntity v1 = doc.addVertex(polyline, DxfPoint.of(0, 0));
        DxfEntity v2 = doc.addVertex(polyline, DxfPoint.of(1, 0));
        String seqend = polyline.seqend().handle();
        int before = doc.database().size();

        doc.delete(polyline);

        assertThat(doc.database().size()).isEqualTo(before - 4);
        assertThat(doc.database().resolve(v1.handle())).isEmpty();
        assertThat(doc.database().resolve(v2.handle())).isEmpty();
        assertThat(doc.database().resolve(seqend)).isEmpty();
    }
}
