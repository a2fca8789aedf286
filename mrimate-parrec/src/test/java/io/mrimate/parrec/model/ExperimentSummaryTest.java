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
import io.mrimate.parrec.header.HeaderParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExperimentSummaryTest {

    private static ScanParameters scan(ParRecFixture fixture) {
        return ParameterModel.fromHeader(new HeaderParser().parse(fixture.parText())).scan();
    }

    @Test
    void describesExperimentAndScan() {
        String summary = ExperimentSummary.describe(scan(ParRecFixture.twoSlices()));
        assertThat(summary).startsWith("Experiment Details:\n");
        assertThat(summary).contains("- Type: Image MRSERIES\n");
        assertThat(summary).contains("- Date: February 04, 2014\n");
        assertThat(summary).contains("Scan Information:\n");
        assertThat(summary).contains("- Technique: T1TFE\n");
        assertThat(summary).contains("- Dimension: 2D\n");
        assertThat(summary).contains("- Resolution: 64x64 pixels\n");
        assertThat(summary).contains("- Slices: 2\n");
        assertThat(summary).contains("- Dynamics: None\n");
        assertThat(summary).contains("- Flow Encoding: No\n");
        assertThat(summary).contains("- Diffusion Encoding: No\n");
    }

    @Test
    void reportsDynamicsFlowAnd3D() {
        ParRecFixture fixture = ParRecFixture.twoSlices()
            .general("Scan mode", "3D")
            .general("Max. number of dynamics", "12")
            .general("Phase encoding velocity [cm/sec]", "0.0 0.0 80.0");
        String summary = ExperimentSummary.describe(scan(fixture));
        assertThat(summary).contains("- Dimension: 3D\n");
        assertThat(summary).contains("- Dynamics: 12\n");
        assertThat(summary).contains("- Flow Encoding: Yes");
    }

    @Test
    void keepsUnparseableDates() {
        assertThat(ExperimentSummary.displayDate("yesterday")).isEqualTo("yesterday");
    }
}
