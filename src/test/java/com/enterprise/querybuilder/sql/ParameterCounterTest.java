package com.enterprise.querybuilder.sql;

import com.enterprise.querybuilder.sql.core.Dialects;
import com.enterprise.querybuilder.sql.param.ParameterCounter;
import com.enterprise.querybuilder.sql.param.Scalar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ParameterCounterTest {

    @Test
    void numberedCounterAdvances() {
        ParameterCounter counter = new ParameterCounter(Dialects.SQL_SERVER, 2);

        assertThat(counter.bind(new Scalar.Text("a"))).isEqualTo("@p3");
        assertThat(counter.bind(new Scalar.Int(9))).isEqualTo("@p4");
        assertThat(counter.position()).isEqualTo(4);
        assertThat(counter.getArguments()).containsExactly("a", 9);
    }

    @Test
    void unnumberedCounterStays() {
        ParameterCounter counter = new ParameterCounter(Dialects.DEFAULT, 2);

        assertThat(counter.bind(new Scalar.Bool(true))).isEqualTo("?");
        assertThat(counter.position()).isEqualTo(2);
    }

    @Test
    void externalValuesMoveNumberedCounter() {
        ParameterCounter counter = new ParameterCounter(Dialects.POSTGRES, 0);
        counter.addExternal(List.of("x", "y"));

        assertThat(counter.position()).isEqualTo(2);
        assertThat(counter.bind(new Scalar.Text("z"))).isEqualTo("$3");
    }

    @Test
    void argumentsAreASnapshot() {
        ParameterCounter counter = new ParameterCounter(Dialects.DEFAULT, 0);
        List<Object> before = counter.getArguments();
        counter.bind(new Scalar.Text("a"));

        assertThat(before).isEmpty();
        assertThatThrownBy(() -> counter.getArguments().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
