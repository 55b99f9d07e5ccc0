package org.pragmatica.yard.converter;

import org.junit.jupiter.api.Test;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.tree.AstNode;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.yard.RpnFixtures.rpn;

class ShuntingYardEngineTest {

    @Test
    void create_keepsConfiguration() {
        var config = new ConverterConfig(ParenthesisPolicy.STRICT, 64);
        var engine = ShuntingYardEngine.create(config);

        assertSame(config, engine.config());
    }

    @Test
    void config_withoutPolicy_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConverterConfig(null, 10));
        assertThrows(IllegalArgumentException.class, () -> new ConverterConfig(ParenthesisPolicy.LENIENT, -1));
    }

    @Test
    void toRpn_inputOverLimit_isRejectedBeforeScanning() {
        var engine = ShuntingYardEngine.create(new ConverterConfig(ParenthesisPolicy.LENIENT, 2));

        var exception = assertThrows(IllegalArgumentException.class, () -> engine.toRpn("x+y"));
        assertThat(exception.getMessage()).contains("maximum length of 2");
    }

    @Test
    void toAst_usesConfiguredPolicy() {
        var strict = ShuntingYardEngine.create(new ConverterConfig(ParenthesisPolicy.STRICT, 100));
        var lenient = ShuntingYardEngine.create(ConverterConfig.DEFAULT);

        assertThat(strict.toAst("(1").getLeft()).isInstanceOf(ConversionError.UnbalancedParenthesis.class);
        assertThat(lenient.toAst("(1").get()).isInstanceOf(AstNode.Leaf.class);
    }

    @Test
    void buildAst_acceptsForeignSequence() {
        var engine = ShuntingYardEngine.create(ConverterConfig.DEFAULT);

        assertEquals("((1 + 2) * 3)", engine.buildAst(rpn(1, 2, "+", 3, "*")).get().toInfix());
        assertThat(engine.buildAst(rpn(1, "*")).getLeft()).isInstanceOf(ConversionError.MalformedRpn.class);
    }

    @Test
    void engine_sharedBetweenThreads_producesSameResults() {
        var engine = ShuntingYardEngine.create(ConverterConfig.DEFAULT);
        var expected = engine.toRpn("(1d4+(5d6%2)/3.4)*(3^(4*2-5d6))").get();
        var mismatches = new ConcurrentLinkedQueue<Integer>();

        IntStream.range(0, 200)
                 .parallel()
                 .forEach(i -> {
                     if (!expected.equals(engine.toRpn("(1d4+(5d6%2)/3.4)*(3^(4*2-5d6))").get())) {
                         mismatches.add(i);
                     }
                 });

        assertEquals(List.of(), List.copyOf(mismatches));
    }
}
