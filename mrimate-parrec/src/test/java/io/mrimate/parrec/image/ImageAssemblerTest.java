package io.mrimate.parrec.image;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.mrimate.parrec.ParRecFixture;
import io.mrimate.parrec.ParRecFixture.Row;
import io.mrimate.parrec.errors.InconsistentGeometryException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.errors.TruncatedDataException;
import io.mrimate.parrec.errors.WarningKind;
import io.mrimate.parrec.header.HeaderParser;
import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ImageAssemblerTest {

    @TempDir
    Path dir;

    private static ParameterModel model(Path par) {
        return ParameterModel.fromHeader(new HeaderParser().parse(par));
    }

    private AssemblyResult assemble(ParRecFixture fixture, int threads) throws IOException {
        Path par = fixture.write(dir, "scan");
        return new ImageAssembler(threads).assemble(model(par), dir.resolve("scan.REC"));
    }

    private static long count(AssemblyResult result, WarningKind kind) {
        return result.warnings().stream().filter(w -> w.kind() == kind).count();
    }

    @Test
    void placesEachRecordInItsSlab() throws IOException {
        ParRecFixture fixture = ParRecFixture.twoSlices()
            .samples((row, r, c) -> row.slice * 1000 + r * 10 + c % 10);
        AssemblyResult result = assemble(fixture, 1);

        assertThat(result.warnings()).isEmpty();
        assertThat(result.images()).containsOnlyKeys(ImageType.MAGNITUDE);
        ImageArray magnitude = result.image(ImageType.MAGNITUDE).orElseThrow();
        assertThat(magnitude.shape()).containsExactly(64, 64, 2, 1, 1, 1);
        assertThat(magnitude.isRescaled()).isFalse();
        assertThat(magnitude.get(0, 0, 0, 0, 0, 0)).isEqualTo(1000.0);
        assertThat(magnitude.get(3, 7, 0, 0, 0, 0)).isEqualTo(1037.0);
        assertThat(magnitude.get(3, 7, 1, 0, 0, 0)).isEqualTo(2037.0);
        assertThat(magnitude.missingSlabCount()).isZero();
    }

    @Test
    void ordersSlicesByRawIndexNotByRecPosition() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .row(new Row().slice(5).fill(500))
            .row(new Row().slice(2).fill(200));
        ImageArray magnitude = assemble(fixture, 1).image(ImageType.MAGNITUDE).orElseThrow();

        assertThat(magnitude.index(Axis.SLICE).rawValues()).containsExactly(2, 5);
        assertThat(magnitude.get(10, 10, 0, 0, 0, 0)).isEqualTo(200.0);
        assertThat(magnitude.get(10, 10, 1, 0, 0, 0)).isEqualTo(500.0);
    }

    @Test
    void failsBeforeReadingATruncatedBuffer() throws IOException {
        ParRecFixture fixture = ParRecFixture.twoSlices();
        byte[] full = fixture.recBytes();
        Path par = fixture.write(dir, "scan", Arrays.copyOf(full, full.length - 1));

        assertThatThrownBy(() -> new ImageAssembler(1).assemble(model(par), dir.resolve("scan.REC")))
            .isInstanceOfSatisfying(TruncatedDataException.class, e -> {
                assertThat(e.getRequiredBytes()).isEqualTo(full.length);
                assertThat(e.getAvailableBytes()).isEqualTo(full.length - 1);
            });
    }

    @Test
    void truncationIsStillDetectedWhileReadingWithoutTheSizeCheck() throws IOException {
        ParRecFixture fixture = ParRecFixture.twoSlices();
        byte[] full = fixture.recBytes();
        Path par = fixture.write(dir, "scan", Arrays.copyOf(full, full.length / 2 + 10));

        assertThatThrownBy(() -> new ImageAssembler(1, false)
            .assemble(model(par), dir.resolve("scan.REC")))
            .isInstanceOf(TruncatedDataException.class);
    }

    @Test
    void skipsRecordsWithAnOddResolution() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .row(new Row().slice(1))
            .row(new Row().slice(2))
            .row(new Row().slice(3).resolution(32, 32).fill(7));
        AssemblyResult result = assemble(fixture, 1);

        ImageArray magnitude = result.image(ImageType.MAGNITUDE).orElseThrow();
        assertThat(magnitude.shape()).containsExactly(64, 64, 2, 1, 1, 1);
        assertThat(magnitude.index(Axis.SLICE).rawValues()).containsExactly(1, 2);
        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.kind()).isEqualTo(WarningKind.INCONSISTENT_GEOMETRY);
            assertThat(w.cause()).get().isInstanceOfSatisfying(InconsistentGeometryException.class,
                e -> assertThat(e.getRecordIndex()).isEqualTo(2));
        });
    }

    @Test
    void dropsATypeWithoutACommonResolution() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .row(new Row().slice(1))
            .row(new Row().slice(2).resolution(32, 32))
            .row(new Row().slice(1).type(3));
        AssemblyResult result = assemble(fixture, 1);

        assertThat(result.images()).containsOnlyKeys(ImageType.PHASE);
        assertThat(count(result, WarningKind.INCONSISTENT_GEOMETRY)).isEqualTo(2);
        assertThat(result.warnings())
            .filteredOn(w -> w.kind() == WarningKind.DROPPED_IMAGE_TYPE)
            .singleElement()
            .extracting(ReconstructionWarning::message)
            .asString()
            .contains("magnitude");
    }

    @Test
    void reportsAnIrregularGridOnce() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .row(new Row().slice(1).echo(1).fill(11))
            .row(new Row().slice(2).echo(2).echoTimeMs(7.0).fill(22));
        AssemblyResult result = assemble(fixture, 1);

        ImageArray magnitude = result.image(ImageType.MAGNITUDE).orElseThrow();
        assertThat(magnitude.shape()).containsExactly(64, 64, 2, 2, 1, 1);
        assertThat(magnitude.get(0, 0, 0, 0, 0, 0)).isEqualTo(11.0);
        assertThat(magnitude.get(0, 0, 1, 1, 0, 0)).isEqualTo(22.0);
        assertThat(magnitude.get(0, 0, 0, 1, 0, 0)).isNaN();
        assertThat(magnitude.get(0, 0, 1, 0, 0, 0)).isNaN();
        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.kind()).isEqualTo(WarningKind.IRREGULAR_GRID);
            assertThat(w.message()).contains("2 of 4");
        });
    }

    @Test
    void decodesEachRecordAtItsOwnWidth() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .row(new Row().slice(1).bits(8).fill(200))
            .row(new Row().slice(1).type(3).bits(32).fill(-1.25))
            .row(new Row().slice(1).type(1).fill(40000));
        AssemblyResult result = assemble(fixture, 1);

        assertThat(result.image(ImageType.MAGNITUDE).orElseThrow().get(5, 5, 0, 0, 0, 0))
            .isEqualTo(200.0);
        assertThat(result.image(ImageType.PHASE).orElseThrow().get(5, 5, 0, 0, 0, 0))
            .isEqualTo(-1.25);
        assertThat(result.image(ImageType.REAL).orElseThrow().get(5, 5, 0, 0, 0, 0))
            .isEqualTo(40000.0);
    }

    @Test
    void pooledAssemblyMatchesInlineAssembly() throws IOException {
        ParRecFixture fixture = new ParRecFixture()
            .samples((row, r, c) -> row.type * 10000 + row.slice * 100 + r + c)
            .row(new Row().slice(1))
            .row(new Row().slice(2))
            .row(new Row().slice(1).type(1))
            .row(new Row().slice(2).type(1))
            .row(new Row().slice(1).type(2))
            .row(new Row().slice(1).type(3))
            .row(new Row().slice(2).type(3));
        Path par = fixture.write(dir, "scan");
        ParameterModel model = model(par);
        Path rec = dir.resolve("scan.REC");

        AssemblyResult inline = new ImageAssembler(1).assemble(model, rec);
        AssemblyResult pooled = new ImageAssembler(4).assemble(model, rec);

        assertThat(pooled.images()).containsOnlyKeys(inline.images().keySet());
        for (ImageType type : inline.images().keySet()) {
            ImageArray a = inline.image(type).orElseThrow();
            ImageArray b = pooled.image(type).orElseThrow();
            assertThat(b.shape()).containsExactly(a.shape());
            assertThat(b.data()).containsExactly(a.data());
        }
        assertThat(pooled.warnings()).isEqualTo(inline.warnings());
    }

    @Test
    void rejectsANonPositiveThreadCount() {
        assertThatThrownBy(() -> new ImageAssembler(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
