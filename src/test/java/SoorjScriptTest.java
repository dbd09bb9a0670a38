import org.junit.jupiter.api.Test;

import com.soorj.script.SoorjScript;
import com.soorj.script.parser.ScriptError;
import com.soorj.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SoorjScriptTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

    private SoorjScript engine() {
        SoorjScript es = new SoorjScript();
        es.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        return es;
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void sumOfTwoVariables_printsWithFraction() {
        engine().run("ա = 10; բ = 20; գ = ա + բ; գրէ(գ)");
        assertEquals("30.0\n", output());
    }

    @Test
    void whileLoop_printsEachIteration() {
        engine().run("ա = 1; մինչև ա <= 3 { գրէ(ա); ա = ա + 1 }");
        assertEquals("1.0\n2.0\n3.0\n", output());
    }

    @Test
    void powerByRepeatedMultiplication() {
        Map<String, Value> env = engine().run(
                "գործ աստիճան(հիմք, ցուցիչ) {\n" +
                "    արդյունք = 1\n" +
                "    մինչև ցուցիչ > 0 {\n" +
                "        արդյունք = արդյունք * հիմք\n" +
                "        ցուցիչ = ցուցիչ - 1\n" +
                "    }\n" +
                "    տուր արդյունք\n" +
                "}\n" +
                "պ = աստիճան(2, 3)\n" +
                "գրէ(պ)\n"
        );

        assertEquals(8.0, v(env, "պ").asNumber(), 1e-9);
        assertEquals("8.0\n", output());
        assertFalse(env.containsKey("արդյունք"), "function locals must not leak into the root frame");
    }

    @Test
    void numberLiteral_stringifiesWithFraction() {
        Map<String, Value> env = engine().run("ա = բառ(30)");
        assertEquals("30.0", v(env, "ա").asString());
    }

    @Test
    void arithmetic_precedenceAndAssociativity() {
        Map<String, Value> env = engine().run(
                "ա = 2 + 3 * 4\n" +
                "բ = (2 + 3) * 4\n" +
                "գ = 10 - 4 - 3\n" +
                "դ = 100 / 10 / 5\n" +
                "ե = -2 * 3\n" +
                "զ = 10 / 4\n"
        );

        assertEquals(14.0, v(env, "ա").asNumber(), 1e-9);
        assertEquals(20.0, v(env, "բ").asNumber(), 1e-9);
        assertEquals(3.0, v(env, "գ").asNumber(), 1e-9);
        assertEquals(2.0, v(env, "դ").asNumber(), 1e-9);
        assertEquals(-6.0, v(env, "ե").asNumber(), 1e-9);
        assertEquals(2.5, v(env, "զ").asNumber(), 1e-9);
    }

    @Test
    void modulo_takesSignOfDivisor() {
        Map<String, Value> env = engine().run(
                "ա = 7 % 3\n" +
                "բ = -7 % 3\n" +
                "գ = 7 % -3\n" +
                "դ = 7.5 % 2\n"
        );

        assertEquals(1.0, v(env, "ա").asNumber(), 1e-9);
        assertEquals(2.0, v(env, "բ").asNumber(), 1e-9);
        assertEquals(-2.0, v(env, "գ").asNumber(), 1e-9);
        assertEquals(1.5, v(env, "դ").asNumber(), 1e-9);
    }

    @Test
    void comparisonsAndEquality() {
        Map<String, Value> env = engine().run(
                "ա = 3; բ = 5\n" +
                "փոքր = ա < բ\n" +
                "փոքրհավ = ա <= 3\n" +
                "մեծ = բ > ա\n" +
                "մեծհավ = բ >= 5\n" +
                "հավ = (ա + 2) == բ\n" +
                "անհավ = ա != բ\n" +
                "ամբողջ = 1 == 1.0\n" +
                "խառը = 1 == \"1\"\n" +
                "դատարկ = հեչ == հեչ\n" +
                "տող = \"ա\" == 'ա'\n"
        );

        assertTrue(v(env, "փոքր").asBool());
        assertTrue(v(env, "փոքրհավ").asBool());
        assertTrue(v(env, "մեծ").asBool());
        assertTrue(v(env, "մեծհավ").asBool());
        assertTrue(v(env, "հավ").asBool());
        assertTrue(v(env, "անհավ").asBool());
        assertTrue(v(env, "ամբողջ").asBool());
        assertFalse(v(env, "խառը").asBool());
        assertTrue(v(env, "դատարկ").asBool());
        assertTrue(v(env, "տող").asBool());
    }

    @Test
    void stringComparison_isLexical() {
        Map<String, Value> env = engine().run("ա = \"10\" < \"9\"\nբ = \"ա\" < \"բ\"");
        assertTrue(v(env, "ա").asBool());
        assertTrue(v(env, "բ").asBool());
    }

    @Test
    void mixedComparison_isTypeError() {
        ScriptError e = assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = 1 < \"2\""));
        assertEquals(ScriptError.Kind.TYPE, e.kind());
    }

    @Test
    void logicalOperators_shortCircuit() {
        Map<String, Value> env = engine().run(
                "ա = ոչ և գրէ(\"չպետք է\")\n" +
                "բ = այո կամ գրէ(\"չպետք է\")\n" +
                "գ = հեչ կամ 5\n" +
                "դ = 1 և \"երկու\"\n"
        );

        assertEquals("", output());
        assertFalse(v(env, "ա").asBool());
        assertTrue(v(env, "բ").asBool());
        assertEquals(5.0, v(env, "գ").asNumber(), 1e-9);
        assertEquals("երկու", v(env, "դ").asString());
    }

    @Test
    void logicalOperators_evaluateRightSideWhenNeeded() {
        engine().run("ա = այո և գրէ(\"և\")\nբ = ոչ կամ գրէ(\"կամ\")");
        assertEquals("և\nկամ\n", output());
    }

    @Test
    void logicalPrecedence_andBindsTighterThanOr() {
        Map<String, Value> env = engine().run(
                "ա = ոչ կամ այո և ոչ\n" +
                "բ = չի ոչ և ոչ\n" +
                "գ = 1 < 2 == այո\n"
        );

        assertFalse(v(env, "ա").asBool());
        assertFalse(v(env, "բ").asBool());
        assertTrue(v(env, "գ").asBool());
    }

    @Test
    void unaryOperators() {
        Map<String, Value> env = engine().run(
                "ա = չի ոչ\n" +
                "բ = չի 0\n" +
                "գ = -5\n" +
                "դ = -(2 + 3)\n" +
                "ե = չի հեչ\n"
        );

        assertTrue(v(env, "ա").asBool());
        assertFalse(v(env, "բ").asBool());
        assertEquals(-5.0, v(env, "գ").asNumber(), 1e-9);
        assertEquals(-5.0, v(env, "դ").asNumber(), 1e-9);
        assertTrue(v(env, "ե").asBool());
    }

    @Test
    void truthiness_zeroAndEmptyStringAreTruthy() {
        Map<String, Value> env = engine().run(
                "ա = \"\"; բ = \"\"; գ = \"\"\n" +
                "եթե 0 { ա = \"ճիշտ\" } հպ { ա = \"սխալ\" }\n" +
                "եթե \"\" { բ = \"ճիշտ\" } հպ { բ = \"սխալ\" }\n" +
                "եթե հեչ { գ = \"ճիշտ\" } հպ { գ = \"սխալ\" }\n"
        );

        assertEquals("ճիշտ", v(env, "ա").asString());
        assertEquals("ճիշտ", v(env, "բ").asString());
        assertEquals("սխալ", v(env, "գ").asString());
    }

    @Test
    void recursion_factorial() {
        Map<String, Value> env = engine().run(
                "գործ ֆակտ(ն) {\n" +
                "    եթե ն <= 1 { տուր 1 }\n" +
                "    տուր ն * ֆակտ(ն - 1)\n" +
                "}\n" +
                "ա = ֆակտ(5)\n"
        );

        assertEquals(120.0, v(env, "ա").asNumber(), 1e-9);
    }

    @Test
    void return_unwindsThroughLoopAndBranch() {
        Map<String, Value> env = engine().run(
                "գործ առաջին(ս) {\n" +
                "    ի = 0\n" +
                "    մինչև այո {\n" +
                "        եթե ի * ի > ս { տուր ի }\n" +
                "        ի = ի + 1\n" +
                "    }\n" +
                "}\n" +
                "ա = առաջին(10)\n"
        );

        assertEquals(4.0, v(env, "ա").asNumber(), 1e-9);
    }

    @Test
    void return_skipsRemainingStatements() {
        engine().run(
                "գործ ֆ() {\n" +
                "    գրէ(\"առաջ\")\n" +
                "    տուր 1\n" +
                "    գրէ(\"հետո\")\n" +
                "}\n" +
                "ֆ()\n"
        );

        assertEquals("առաջ\n", output());
    }

    @Test
    void functionWithoutReturn_yieldsNull() {
        Map<String, Value> env = engine().run(
                "գործ դատարկ() { }\n" +
                "գործ միայն() {\n" +
                "    տուր\n" +
                "}\n" +
                "գործ կետով() { տուր; գրէ(\"չի տպվի\") }\n" +
                "ա = դատարկ()\n" +
                "բ = միայն()\n" +
                "գ = կետով()\n"
        );

        assertTrue(v(env, "ա").isNull());
        assertTrue(v(env, "բ").isNull());
        assertTrue(v(env, "գ").isNull());
        assertEquals("", output());
    }

    @Test
    void functionsAreValues_comparedByIdentity() {
        Map<String, Value> env = engine().run(
                "գործ ֆ() { տուր 1 }\n" +
                "գործ գ() { տուր 1 }\n" +
                "նույն = ֆ == ֆ\n" +
                "տարբեր = ֆ == գ\n" +
                "պատճեն = ֆ\n" +
                "ա = պատճեն()\n"
        );

        assertTrue(v(env, "նույն").asBool());
        assertFalse(v(env, "տարբեր").asBool());
        assertEquals(1.0, v(env, "ա").asNumber(), 1e-9);
        assertEquals(Value.Type.FUNC, v(env, "ֆ").getType());
    }

    @Test
    void comments_andOptionalSemicolons() {
        Map<String, Value> env = engine().run(
                "# մեկնաբանություն\n" +
                "ա = 1 # տողի վերջում\n" +
                ";; բ = 2;\n"
        );

        assertEquals(1.0, v(env, "ա").asNumber(), 1e-9);
        assertEquals(2.0, v(env, "բ").asNumber(), 1e-9);
    }

    @Test
    void divisionByZero_stopsTheUnit() {
        SoorjScript es = engine();
        ScriptError e = assertThrows(ScriptError.ArithmeticError.class,
                () -> es.run("գրէ(\"առաջ\")\nա = 5 / 0\nգրէ(\"հետո\")\n"));

        assertEquals(ScriptError.Kind.ARITHMETIC, e.kind());
        assertEquals(2, e.line());
        assertEquals("առաջ\n", output());
    }

    @Test
    void moduloByZero_isArithmeticError() {
        assertThrows(ScriptError.ArithmeticError.class, () -> engine().run("ա = 5 % 0"));
    }

    @Test
    void arithmeticOnNonNumbers_isTypeError() {
        assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = 1 + \"ա\""));
        assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = \"ա\" + \"բ\""));
        assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = այո * 2"));
        assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = -\"ա\""));
        assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = հեչ - 1"));
    }

    @Test
    void callingNonFunction_isTypeError() {
        ScriptError e = assertThrows(ScriptError.TypeError.class, () -> engine().run("ա = 5\nա()"));
        assertTrue(e.getMessage().contains("not callable"));
        assertThrows(ScriptError.TypeError.class, () -> engine().run("\"ա\"()"));
    }

    @Test
    void wrongArgumentCount_isArityError() {
        ScriptError e = assertThrows(ScriptError.ArityError.class,
                () -> engine().run("գործ ֆ(ա) { տուր ա }\nֆ(1, 2)"));
        assertEquals(2, e.line());
        assertThrows(ScriptError.ArityError.class, () -> engine().run("գործ ֆ(ա) { տուր ա }\nֆ()"));
    }

    @Test
    void undefinedVariable_isNameError() {
        ScriptError e = assertThrows(ScriptError.NameError.class, () -> engine().run("ա = 1\nգրէ(բ)"));
        assertEquals(ScriptError.Kind.NAME, e.kind());
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("բ"));
    }

    @Test
    void argumentsEvaluateLeftToRight() {
        engine().run(
                "գործ նշիր(ա) { գրէ(ա); տուր ա }\n" +
                "գործ գումար(ա, բ, գ) { տուր ա + բ + գ }\n" +
                "գրէ(գումար(նշիր(1), նշիր(2), նշիր(3)))\n"
        );

        assertEquals("1.0\n2.0\n3.0\n6.0\n", output());
    }

    @Test
    void latinIdentifiersAreLetters() {
        Map<String, Value> env = engine().run("x1 = 4\ny = x1 * 2");
        assertEquals(8.0, v(env, "y").asNumber(), 1e-9);
    }
}
