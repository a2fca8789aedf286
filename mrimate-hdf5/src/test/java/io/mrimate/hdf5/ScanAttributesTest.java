package io.mrimate.hdf5;

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

import io.mrimate.parrec.header.HeaderParser;
import io.mrimate.parrec.model.ParameterModel;
import io.mrimate.parrec.model.ScanParameters;
import io.mrimate.parrec.image.Axis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ScanAttributesTest {

    private static ScanParameters scan(ParRecFixture fixture) {
        return ParameterModel.fromHeader(new HeaderParser().parse(fixture.parText())).scan();
    }

    @Test
    void namesComponentsInSnakeCase() {
        Map<String, Object> attrs = ScanAttributes.of(scan(ParRecFixture.twoSlices()));

        assertThat(attrs)
            .containsEntry("patient_name", "Test Subject")
            .containsEntry("max_slices", 2)
            .containsEntry("scan_mode", "MS")
            .containsKeys("examination_date_time", "water_fat_shift", "scan_resolution")
            .doesNotContainKeys("extras", "venc", "field_strength");
        assertThat(attrs.get("scan_resolution"))
            .isInstanceOfSatisfying(int[].class, res -> assertThat(res).containsExactly(64, 64));
    }

    @Test
    void writesQuantitiesWithTheirUnits() {
        Map<String, Object> attrs = ScanAttributes.of(scan(ParRecFixture.twoSlices()));

        assertThat(attrs).containsEntry("repetition_time", 0.005)
            .containsEntry("repetition_time_unit", "s")
            .containsEntry("scan_duration_unit", "s")
            .containsEntry("off_centre_midslice_unit", "mm")
            .containsEntry("echo_times_unit", "s");
        assertThat(attrs.get("off_centre_midslice"))
            .isInstanceOfSatisfying(double[].class, v -> assertThat(v).containsExactly(1, 2, 3));
        assertThat(attrs.get("echo_times"))
            .isInstanceOfSatisfying(double[].class, v -> assertThat(v).containsExactly(0.0035));
    }

    @Test
    void addsVencForFlowScans() {
        ParRecFixture fixture = ParRecFixture.twoSlices()
            .general("Phase encoding velocity [cm/sec]", "0.000000  0.000000  -120.000000");

        Map<String, Object> attrs = ScanAttributes.of(scan(fixture));

        assertThat(attrs).containsEntry("venc", 120.0).containsEntry("venc_unit", "cm/s");
    }

    @ParameterizedTest
    @CsvSource({
        "patientName, patient_name",
        "maxCardiacPhases, max_cardiac_phases",
        "mtc, mtc",
        "fov, fov"
    })
    void convertsCamelCase(String component, String attribute) {
        assertThat(ContainerLayout.snakeCase(component)).isEqualTo(attribute);
    }

    @ParameterizedTest
    @CsvSource({
        "'Max. number of gradient orients', max_number_of_gradient_orients",
        "'Water Fat shift [pixels]', water_fat_shift_pixels",
        "'<0=no 1=yes> ?', 0_no_1_yes",
        "'???', entry"
    })
    void sanitizesHeaderKeys(String key, String name) {
        assertThat(ContainerLayout.attributeName(key)).isEqualTo(name);
    }

    @Test
    void namesPositionDatasetsAfterTheirAxis() {
        assertThat(ContainerLayout.positionsName(Axis.CARDIAC_PHASE))
            .isEqualTo("cardiac_phase_positions");
    }
}
