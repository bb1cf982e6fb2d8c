package io.nosqlbench.matrix;

/*
 * Copyright (c) nosqlbench
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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static io.nosqlbench.matrix.ElementTypes.INTEGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MatrixAccessTest {

    private static Matrix<Integer> sample() {
        return Matrix.of(INTEGER, 2, 3, 1, 2, 3, 4, 5, 6);
    }

    @Test
    void checkedAndUncheckedReadsAgreeInBounds() {
        Matrix<Integer> m = sample();
        for (int i = 0; i < m.rows(); i++) {
            for (int j = 0; j < m.cols(); j++) {
                assertThat(m.at(i, j)).isEqualTo(m.get(i, j));
            }
        }
    }

    @ParameterizedTest
    @CsvSource({"2,0", "0,3", "2,3", "-1,0", "0,-1", "5,5"})
    void checkedAccessRejectsOutOfRangeIndices(int row, int col) {
        Matrix<Integer> m = sample();

        assertThatThrownBy(() -> m.at(row, col))
            .isInstanceOf(IndexOutOfRangeException.class)
            .hasMessageContaining("2x3");
        assertThatThrownBy(() -> m.setAt(row, col, 99))
            .isInstanceOf(IndexOutOfRangeException.class);
        assertThat(m).isEqualTo(sample());
    }

    @Test
    void uncheckedWriteIsVisibleThroughCheckedRead() {
        Matrix<Integer> e = sample();
        e.set(0, 2, 7);

        assertThat(e.at(0, 2)).isEqualTo(7);
        assertThat(e.toList()).containsExactly(1, 2, 7, 4, 5, 6);
    }

    @Test
    void checkedWriteUpdatesOnlyTheAddressedElement() {
        Matrix<Integer> m = sample();
        m.setAt(1, 1, 50);

        assertThat(m.toList()).containsExactly(1, 2, 3, 4, 50, 6);
    }

    @Test
    void uncheckedAccessDoesNotValidateColumnIndex() {
        Matrix<Integer> m = sample();

        // (0, 3) is past the end of row 0 and lands on the first element of row 1
        assertThat(m.get(0, 3)).isEqualTo(4);
    }

    @Test
    void toListIsASnapshot() {
        Matrix<Integer> m = sample();
        List<Integer> snapshot = m.toList();
        m.set(0, 0, 100);

        assertThat(snapshot.get(0)).isEqualTo(1);
        assertThatThrownBy(() -> snapshot.set(0, 5))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
