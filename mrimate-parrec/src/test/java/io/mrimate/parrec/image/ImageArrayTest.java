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

import io.mrimate.parrec.model.ImageType;
import io.mrimate.parrec.model.ParameterRecord;
import io.mrimate.parrec.model.Resolution;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ImageArrayTest {

    private static ImageArray allocate() {
        return ImageArray.allocate(
            ImageType.MAGNITUDE,
            new Resolution(2, 3),
            AxisIndex.of(1, 2),
            AxisIndex.of(1),
            AxisIndex.of(1, 2, 3),
            AxisIndex.of(1)
        );
    }

    private static boolean allSentinel(double[] values) {
        return Arrays.stream(values).allMatch(Double::isNaN);
    }

    @Test
    void startsFilledWithTheSentinel() {
        ImageArray array = allocate();
        assertThat(array.shape()).containsExactly(2, 3, 2, 1, 3, 1);
        assertThat(array.data()).hasSize(36);
        assertThat(allSentinel(array.data())).isTrue();
        assertThat(array.slabCount()).isEqualTo(6);
        assertThat(array.missingSlabCount()).isEqualTo(6);
        assertThat(array.isRescaled()).isFalse();
        assertThat(array.unit()).isEmpty();
        assertThat(array.toString()).contains("stored");
    }

    @Test
    void placesSlabSamplesAtTheirIndices() {
        ImageArray array = allocate();
        double[] samples = {0, 1, 2, 10, 11, 12};
        SlabPosition position = new SlabPosition(1, 0, 2, 0);
        array.fillSlab(position, null, samples);

        assertThat(array.get(0, 0, 1, 0, 2, 0)).isEqualTo(0.0);
        assertThat(array.get(0, 2, 1, 0, 2, 0)).isEqualTo(2.0);
        assertThat(array.get(1, 0, 1, 0, 2, 0)).isEqualTo(10.0);
        assertThat(array.get(1, 2, 1, 0, 2, 0)).isEqualTo(12.0);
        assertThat(array.get(1, 2, 0, 0, 2, 0)).isNaN();
        assertThat(array.slab(position)).containsExactly(samples);
        assertThat(array.missingSlabCount()).isEqualTo(5);

        // row-major over [r][c][s][e][d][p]
        double[] flat = array.data();
        int index = ((((1 * 3 + 2) * 2 + 1) * 1 + 0) * 3 + 2) * 1 + 0;
        assertThat(flat[index]).isEqualTo(12.0);
        assertThat(Arrays.stream(flat).filter(v -> !Double.isNaN(v)).count()).isEqualTo(6);
    }

    @Test
    void refusesToFillASlabTwice() {
        ImageArray array = allocate();
        array.fillSlab(new SlabPosition(0, 0, 0, 0), null, new double[6]);
        assertThatThrownBy(() -> array.fillSlab(new SlabPosition(0, 0, 0, 0), null, new double[6]))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void refusesWrongSlabSize() {
        assertThatThrownBy(() -> allocate().fillSlab(new SlabPosition(0, 0, 0, 0), null,
            new double[5])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rescalesOnceAndFreezes() {
        ImageArray array = allocate();
        array.fillSlab(new SlabPosition(0, 0, 0, 0), null, new double[]{1, 2, 3, 4, 5, 6});
        DoubleUnaryOperator twice = v -> v * 2;
        array.rescale((ParameterRecord r) -> twice, UnitTag.DIMENSIONLESS);

        assertThat(array.isRescaled()).isTrue();
        assertThat(array.unit()).contains(UnitTag.DIMENSIONLESS);
        assertThat(array.slab(new SlabPosition(0, 0, 0, 0))).containsExactly(2, 4, 6, 8, 10, 12);
        assertThat(allSentinel(array.slab(new SlabPosition(1, 0, 0, 0)))).isTrue();

        assertThatThrownBy(() -> array.rescale(r -> twice, UnitTag.DIMENSIONLESS))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> array.fillSlab(new SlabPosition(1, 0, 0, 0), null, new double[6]))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restoredArraysAreReadOnly() {
        ImageArray array = ImageArray.restore(ImageType.PHASE, new int[]{1, 2, 1, 1, 1, 1},
            new double[]{0.5, -0.5}, UnitTag.RADIANS,
            AxisIndex.of(4), AxisIndex.of(1), AxisIndex.of(1), AxisIndex.of(1));
        assertThat(array.isRescaled()).isTrue();
        assertThat(array.get(0, 1, 0, 0, 0, 0)).isEqualTo(-0.5);
        assertThat(array.index(Axis.SLICE).rawValues()).containsExactly(4);
        assertThatThrownBy(() -> array.fillSlab(new SlabPosition(0, 0, 0, 0), null,
            new double[2])).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restoreChecksTheShape() {
        assertThatThrownBy(() -> ImageArray.restore(ImageType.PHASE, new int[]{1, 2, 1, 1, 1, 1},
            new double[3], UnitTag.RADIANS,
            AxisIndex.of(4), AxisIndex.of(1), AxisIndex.of(1), AxisIndex.of(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
