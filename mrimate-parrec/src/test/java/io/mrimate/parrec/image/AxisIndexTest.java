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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AxisIndexTest {

    @Test
    void mapsSparseRawValuesToContiguousPositions() {
        AxisIndex index = AxisIndex.of(List.of(7, 3, 5, 3, 7));
        assertThat(index.size()).isEqualTo(3);
        assertThat(index.positionOf(3)).isZero();
        assertThat(index.positionOf(5)).isEqualTo(1);
        assertThat(index.positionOf(7)).isEqualTo(2);
        assertThat(index.rawValueAt(2)).isEqualTo(7);
        assertThat(index.rawValues()).containsExactly(3, 5, 7);
    }

    @Test
    void keepsAscendingOrderRegardlessOfInputOrder() {
        assertThat(AxisIndex.of(4, 1, 2).rawValues()).containsExactly(1, 2, 4);
    }

    @Test
    void rejectsUnknownRawValues() {
        AxisIndex index = AxisIndex.of(1, 2);
        assertThatThrownBy(() -> index.positionOf(3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("3");
    }
}
