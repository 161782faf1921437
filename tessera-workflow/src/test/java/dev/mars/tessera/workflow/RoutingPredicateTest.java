/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tessera.workflow;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingPredicateTest {

    @Test
    void parsesTypedLiterals() {
        assertThat(RoutingPredicate.parse("amount >= 1000").getCondition().getExpected()).isEqualTo(1000L);
        assertThat(RoutingPredicate.parse("score < 0.5").getCondition().getExpected()).isEqualTo(0.5);
        assertThat(RoutingPredicate.parse("urgent == true").getCondition().getExpected()).isEqualTo(true);
        assertThat(RoutingPredicate.parse("name == 'Ada Lovelace'").getCondition().getExpected())
                .isEqualTo("Ada Lovelace");
    }

    @Test
    void mapsOperators() {
        Condition condition = RoutingPredicate.parse("customer.tier != gold").getCondition();

        assertThat(condition.getFieldPath()).isEqualTo("customer.tier");
        assertThat(condition.getOperator()).isEqualTo(ConditionOperator.NOT_EQUALS);
        assertThat(condition.isCaseSensitive()).isTrue();
        assertThat(RoutingPredicate.parse("email matches .*@acme").getCondition().getOperator())
                .isEqualTo(ConditionOperator.REGEX);
        assertThat(RoutingPredicate.parse("region exists").getCondition().getOperator())
                .isEqualTo(ConditionOperator.EXISTS);
    }

    @Test
    void parsesInLists() {
        Condition condition = RoutingPredicate.parse("region in [emea, apac, 7]").getCondition();

        assertThat(condition.getOperator()).isEqualTo(ConditionOperator.IN);
        assertThat(condition.getExpected()).isEqualTo(List.of("emea", "apac", 7L));
    }

    @Test
    void rejectsMalformedKeys() {
        assertThatThrownBy(() -> RoutingPredicate.parse("priority")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RoutingPredicate.parse("priority ~= high"))
                .hasMessageContaining("Unknown operator");
        assertThatThrownBy(() -> RoutingPredicate.parse("priority ==")).hasMessageContaining("Missing value");
        assertThat(RoutingPredicate.tryParse("region exists now")).isEmpty();
    }
}
