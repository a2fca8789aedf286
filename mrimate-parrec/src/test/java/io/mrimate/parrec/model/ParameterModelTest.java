package io.mrimate.parrec.model;

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
import io.mrimate.parrec.errors.InvalidParameterException;
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.ReconstructionWarning;
import io.mrimate.parrec.errors.WarningKind;
import io.mrimate.parrec.header.HeaderParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ParameterModelTest {

    private static ParameterModel model(ParRecFixture fixture) {
        return ParameterModel.fromHeader(new HeaderParser().parse(fixture.parText()));
    }

    @Nested
    @DisplayName("scan parameters")
    class Scan {

        @Test
        void normalizesUnits() {
            ScanParameters scan = model(ParRecFixture.twoSlices()).scan();
            assertThat(scan.repetitionTime().unit()).isEqualTo(PhysicalUnit.SECOND);
            assertThat(scan.repetitionTime().value()).isCloseTo(0.005, within(1e-12));
            assertThat(scan.scanDuration().value()).isEqualTo(126.0);
            assertThat(scan.fov()).extracting(Quantity::value).containsExactly(240.0, 10.0, 240.0);
            assertThat(scan.fov()[0].unit()).isEqualTo(PhysicalUnit.MILLIMETRE);
            assertThat(scan.scanResolution()).containsExactly(64, 64);
            assertThat(scan.echoTimes()).hasSize(1);
            assertThat(scan.echoTimes().get(0).value()).isCloseTo(0.0035, within(1e-12));
        }

        @Test
        void readsTextFields() {
            ScanParameters scan = model(ParRecFixture.twoSlices()).scan();
            assertThat(scan.patientName()).isEqualTo("Test Subject");
            assertThat(scan.technique()).isEqualTo("T1TFE");
            assertThat(scan.examinationDateTime()).isEqualTo("2014.02.04 / 10:42:03");
            assertThat(scan.maxSlices()).isEqualTo(2);
            assertThat(scan.fieldStrength()).isEmpty();
        }

        @Test
        void derivesVencFromLargestComponent() {
            ParRecFixture fixture = ParRecFixture.twoSlices()
                .general("Phase encoding velocity [cm/sec]", "0.000000  -50.000000  20.000000");
            ScanParameters scan = model(fixture).scan();
            assertThat(scan.venc()).get().extracting(Quantity::value).isEqualTo(50.0);
            assertThat(model(ParRecFixture.twoSlices()).scan().venc()).isEmpty();
        }

        @Test
        void defaultsMissingEntriesWithWarning() {
            ParameterModel model = model(
                ParRecFixture.twoSlices().withoutGeneral("Repetition time [ms]"));
            assertThat(model.scan().repetitionTime().value()).isEqualTo(0.0);
            assertThat(model.warnings()).hasSize(1);
            ReconstructionWarning warning = model.warnings().get(0);
            assertThat(warning.kind()).isEqualTo(WarningKind.INVALID_PARAMETER);
            assertThat(warning.message()).contains("repetition time");
        }

        @Test
        void defaultsUncoercibleEntriesWithWarning() {
            ParameterModel model = model(
                ParRecFixture.twoSlices().general("Max. number of slices/locations", "many"));
            assertThat(model.scan().maxSlices()).isZero();
            assertThat(model.warnings()).extracting(ReconstructionWarning::kind)
                .containsExactly(WarningKind.INVALID_PARAMETER);
        }

        @Test
        void keepsUnknownEntriesVerbatim() {
            ParameterModel model = model(
                ParRecFixture.twoSlices().general("Vendor specific thing", "a  b   7"));
            assertThat(model.scan().extras()).containsEntry("Vendor specific thing", "a b 7");
            assertThat(model.warnings()).isEmpty();
        }

        @Test
        void readsOptionalFieldStrength() {
            ScanParameters scan =
                model(ParRecFixture.twoSlices().general("Field strength [T]", "3.0")).scan();
            assertThat(scan.fieldStrength()).contains(Quantity.of(3.0, PhysicalUnit.TESLA));
        }
    }

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        void normalizesRecordTimes() {
            ParameterRecord record = model(ParRecFixture.twoSlices()).records().get(0);
            assertThat(record.echoTime().unit()).isEqualTo(PhysicalUnit.SECOND);
            assertThat(record.echoTime().value()).isCloseTo(0.0035, within(1e-12));
            assertThat(record.geometry().pixelSpacing()).extracting(Quantity::value)
                .containsExactly(3.75, 3.75);
            assertThat(record.resolution()).isEqualTo(new Resolution(64, 64));
            assertThat(record.bytesPerSample()).isEqualTo(2);
        }

        @Test
        void excludesInvalidRecords() {
            ParRecFixture fixture = ParRecFixture.twoSlices().row(new Row().slice(3).bits(12));
            ParameterModel model = model(fixture);
            assertThat(model.records()).hasSize(2);
            assertThat(model.warnings()).hasSize(1);
            InvalidParameterException cause =
                (InvalidParameterException) model.warnings().get(0).cause().orElseThrow();
            assertThat(cause.getField()).isEqualTo("image pixel size");
            assertThat(cause.getRecordIndex()).isEqualTo(2);
        }

        @Test
        void rejectsNegativeIndexFields() {
            ParameterModel model = model(ParRecFixture.twoSlices().row(new Row().slice(-1)));
            assertThat(model.records()).hasSize(2);
            assertThat(model.warnings()).singleElement()
                .extracting(ReconstructionWarning::message).asString().contains("slice number");
        }

        @Test
        void rejectsUnknownImageType() {
            ParameterModel model = model(ParRecFixture.twoSlices().row(new Row().slice(3).type(7)));
            assertThat(model.records()).hasSize(2);
            assertThat(model.warnings()).singleElement()
                .extracting(ReconstructionWarning::message).asString().contains("image type");
        }

        @Test
        void rejectsDuplicateKeysForLaterRecord() {
            ParameterModel model = model(ParRecFixture.twoSlices().row(new Row().slice(1)));
            assertThat(model.records()).extracting(ParameterRecord::recordIndex)
                .containsExactly(0, 1);
            InvalidParameterException cause =
                (InvalidParameterException) model.warnings().get(0).cause().orElseThrow();
            assertThat(cause.getRecordIndex()).isEqualTo(2);
        }

        @Test
        void computesOffsetsInRecIndexOrder() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1).recIndex(2))
                .row(new Row().slice(2).recIndex(0).bits(8))
                .row(new Row().slice(3).recIndex(1).resolution(32, 32));
            ParameterModel model = model(fixture);
            assertThat(model.records()).extracting(ParameterRecord::byteOffset)
                .containsExactly(64L * 64 + 32 * 32 * 2, 0L, 64L * 64);
            assertThat(model.records()).extracting(ParameterRecord::byteLength)
                .containsExactly(64L * 64 * 2, 64L * 64, 32L * 32 * 2);
            assertThat(model.requiredRecBytes()).isEqualTo(64L * 64 * 3 + 32 * 32 * 2);
        }

        @Test
        void excludedRecordsStillOccupyTheBuffer() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1).type(9))
                .row(new Row().slice(2));
            ParameterModel model = model(fixture);
            assertThat(model.records()).singleElement()
                .extracting(ParameterRecord::byteOffset).isEqualTo(64L * 64 * 2);
            assertThat(model.requiredRecBytes()).isEqualTo(64L * 64 * 2 * 2);
        }

        @Test
        void skippedRowsStillOccupyTheBuffer() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1).extraColumns(1))
                .row(new Row().slice(2))
                .row(new Row().slice(3));
            ParameterModel model = model(fixture);
            assertThat(model.warnings()).extracting(ReconstructionWarning::kind)
                .containsExactly(WarningKind.MALFORMED_RECORD);
            assertThat(model.records()).extracting(ParameterRecord::byteOffset)
                .containsExactly(64L * 64 * 2, 64L * 64 * 2 * 2);
            assertThat(model.requiredRecBytes()).isEqualTo(64L * 64 * 2 * 3);
        }

        @Test
        void failsWhenASkippedRowHidesTheSizeOfAnEarlierImage() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(2).recIndex(1))
                .row(new Row().slice(3).recIndex(2))
                .rawLine("  1 1 1 1 0 2 0 16");
            assertThatThrownBy(() -> model(fixture))
                .isExactlyInstanceOf(ParRecException.class)
                .hasMessageContaining("REC index 0");
        }

        @Test
        void failsWhenNoRowDeclaresAnEarlierRecIndex() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1).recIndex(0))
                .row(new Row().slice(2).recIndex(2));
            assertThatThrownBy(() -> model(fixture))
                .isExactlyInstanceOf(ParRecException.class)
                .hasMessageContaining("no image row declares REC index 1");
        }

        @Test
        void ignoresUnsizedSkippedRowsAfterTheLastImage() {
            ParameterModel model = model(ParRecFixture.twoSlices().rawLine("  1 1 1 1 0 2 7 16"));
            assertThat(model.records()).extracting(ParameterRecord::byteOffset)
                .containsExactly(0L, 64L * 64 * 2);
            assertThat(model.requiredRecBytes()).isEqualTo(64L * 64 * 2 * 2);
        }
    }

    @Nested
    @DisplayName("derived values")
    class Derived {

        @Test
        void computesExtentsPerImageType() {
            ParRecFixture fixture = new ParRecFixture();
            for (int slice = 1; slice <= 3; slice++) {
                for (int dyn = 1; dyn <= 2; dyn++) {
                    fixture.row(new Row().slice(slice).dynamic(dyn));
                    fixture.row(new Row().slice(slice).dynamic(dyn).type(3));
                }
            }
            ParameterModel model = model(fixture);
            assertThat(model.imageTypes()).containsExactly(ImageType.MAGNITUDE, ImageType.PHASE);
            assertThat(model.extentsOf(ImageType.MAGNITUDE)).get()
                .extracting(AxisExtents::shape).isEqualTo(new int[]{64, 64, 3, 1, 2, 1});
            assertThat(model.extentsOf(ImageType.REAL)).isEmpty();
            assertThat(model.recordsOf(ImageType.PHASE)).hasSize(6);
            assertThat(model.uniqueSliceCount()).isEqualTo(3);
        }

        @Test
        void extentsUseTheMostCommonResolution() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1))
                .row(new Row().slice(2))
                .row(new Row().slice(3).resolution(32, 32));
            AxisExtents extents = model(fixture).extentsOf(ImageType.MAGNITUDE).orElseThrow();
            assertThat(extents.resolution()).isEqualTo(new Resolution(64, 64));
            assertThat(extents.slices()).isEqualTo(2);
        }

        @Test
        void tiedResolutionsHaveNoExtents() {
            ParRecFixture fixture = new ParRecFixture()
                .row(new Row().slice(1))
                .row(new Row().slice(2).resolution(32, 32));
            assertThat(model(fixture).extentsOf(ImageType.MAGNITUDE)).isEmpty();
        }

        @Test
        void looksUpRecordsByIndex() {
            ParameterModel model = model(ParRecFixture.twoSlices());
            assertThat(model.record(1)).get()
                .extracting(r -> r.key().slice()).isEqualTo(2);
            assertThat(model.record(5)).isEmpty();
        }
    }
}
