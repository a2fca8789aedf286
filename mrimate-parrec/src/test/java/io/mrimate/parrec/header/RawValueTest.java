package io.mrimate.parrec.header;

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

import io.mrimate.parrec.errors.UnsupportedVersionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RawValueTest {

    @ParameterizedTest
    @CsvSource({
        "42, INTEGER",
        "-7, INTEGER",
        "3.750, FLOAT",
        "-1.5e-3, FLOAT",
        "1., FLOAT",
        "NaN, STRING",
        "Infinity, STRING",
        "1f, STRING",
        "T1TFE, STRING",
        "'(x,y)', STRING"
    })
    void classifiesTokens(String token, RawValue.Kind kind) {
        assertThat(RawValue.of(token).kind()).isEqualTo(kind);
    }

    @Test
    void coercesNumbers() {
        assertThat(RawValue.of("12").asLong()).hasValue(12L);
        assertThat(RawValue.of("12").asDouble()).hasValue(12.0);
        assertThat(RawValue.of("2.5").asLong()).isEmpty();
        assertThat(RawValue.of("2.5").asDouble()).hasValue(2.5);
        assertThat(RawValue.of("abc").asDouble()).isEmpty();
        assertThat(RawValue.of("abc").isNumeric()).isFalse();
    }

    @Test
    void resolvesHeaderVersions() {
        assertThat(HeaderVersion.fromDeclared("V4.2")).isEqualTo(HeaderVersion.V4_2);
        assertThat(HeaderVersion.fromDeclared("4.1")).isEqualTo(HeaderVersion.V4_1);
        assertThat(HeaderVersion.V4.columnCount()).isEqualTo(41);
        assertThat(HeaderVersion.V4_1.columnCount()).isEqualTo(48);
        assertThat(HeaderVersion.V4_2.columnCount()).isEqualTo(49);
        assertThat(HeaderVersion.V4.hasDiffusionColumns()).isFalse();
        assertThat(HeaderVersion.V4_2.hasLabelTypeColumn()).isTrue();
        assertThatThrownBy(() -> HeaderVersion.fromDeclared("V5"))
            .isInstanceOf(UnsupportedVersionException.class);
        assertThatThrownBy(() -> HeaderVersion.fromDeclared(null))
            .isInstanceOf(UnsupportedVersionException.class);
    }
}
