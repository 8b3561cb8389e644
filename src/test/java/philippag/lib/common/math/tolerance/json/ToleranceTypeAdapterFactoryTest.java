package philippag.lib.common.math.tolerance.json;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;

import philippag.lib.common.math.tolerance.Fixed16;
import philippag.lib.common.math.tolerance.Fixed32;
import philippag.lib.common.math.tolerance.Fixed64;
import philippag.lib.common.math.tolerance.Tolerance128;
import philippag.lib.common.math.tolerance.Tolerance64;

public class ToleranceTypeAdapterFactoryTest {

    private static final Gson GSON = ToleranceGson.gson();

    private static final Tolerance128 BORE = Tolerance128.fromTicks(125_000, 3_000, -2_000);

    static class Drawing {
        String name;
        Tolerance128 bore;
        Tolerance64 slot;
        List<Tolerance128> holes;
    }

    private static Tolerance128 read(String json) {
        return GSON.fromJson(json, Tolerance128.class);
    }

    /* =======
     * writing
     * =======
     */

    @Test
    public void writeStruct() {
        Assert.assertEquals("{\"value\":125000,\"plus\":3000,\"minus\":-2000}", GSON.toJson(BORE));
        Assert.assertEquals("null", GSON.toJson(null, Tolerance128.class));
    }

    @Test
    public void writeString() {
        var gson = ToleranceGson.gson(ToleranceGson.Style.STRING);
        Assert.assertEquals("\"12.5 +0.3/-0.2\"", gson.toJson(BORE));
        Assert.assertEquals("\"2.0 +/-0.005\"", gson.toJson(Tolerance64.fromString("2 +/-0.005")));
    }

    @Test
    public void writeFloats() {
        Assert.assertEquals("{\"value\":12.5,\"plus\":0.3,\"minus\":-0.2}", ToleranceGson.gson(ToleranceGson.Style.FLOAT_STRUCT).toJson(BORE));
        Assert.assertEquals("[12.5,0.3,-0.2]", ToleranceGson.gson(ToleranceGson.Style.FLOAT_SEQUENCE).toJson(BORE));
    }

    @Test
    public void writeNested() {
        var drawing = new Drawing();
        drawing.name = "flange";
        drawing.bore = BORE;
        drawing.holes = List.of(Tolerance128.fromString("6 +/-0.1"));
        Assert.assertEquals("{\"name\":\"flange\",\"bore\":\"12.5 +0.3/-0.2\",\"holes\":[\"6.0 +/-0.1\"]}",
                ToleranceGson.gson(ToleranceGson.Style.STRING).toJson(drawing));
    }

    /* =======
     * reading
     * =======
     */

    @Test
    public void readObject() {
        Assert.assertEquals(BORE, read("{\"value\":125000,\"plus\":3000,\"minus\":-2000}"));
        Assert.assertEquals(BORE, read("{\"v\":\"12.5\",\"p\":\"0.3\",\"m\":\"-0.2\"}"));
        Assert.assertEquals(BORE, read("{\"minus\":-0.2,\"plus\":0.3,\"value\":12.5,\"comment\":[1,2]}"));
        Assert.assertEquals(Tolerance128.fromString("12.5 +/-0.3"), read("{\"v\":\"12.5\",\"p\":\"0.3\"}"));
        Assert.assertEquals(Tolerance128.fromString("12.5 +/-0.3"), read("{\"v\":\"12.5\",\"p\":\"0.3\",\"m\":\"\"}"));
        Assert.assertEquals(Tolerance128.fromString("12.5"), read("{\"v\":\"12.5\"}"));
        Assert.assertEquals(Tolerance128.fromString("12.5"), read("{\"v\":\"12.5\",\"p\":\" \"}"));
    }

    @Test
    public void readObjectErrors() {
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{}"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{\"p\":\"0.3\"}"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{\"v\":\"12.5\",\"m\":\"-0.2\"}"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{\"v\":1,\"p\":-5,\"m\":5}"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{\"v\":1,\"p\":\"x\"}"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("{\"v\":1,\"p\":5000000000}"));
    }

    @Test
    public void readArray() {
        Assert.assertEquals(BORE, read("[\"12.5\",\"0.3\",\"-0.2\"]"));
        Assert.assertEquals(BORE, read("[12.5,0.3,-0.2]"));
        Assert.assertEquals(BORE, read("[125000,3000,-2000]"));
        Assert.assertEquals(Tolerance128.fromTicks(125_000, 3_000), read("[125000,3000]"));
        Assert.assertEquals(Tolerance128.fromTicks(125_000, 0, 0), read("[125000]"));

        Assert.assertThrows(JsonSyntaxException.class, () -> read("[]"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("[1,2,3,4]"));
        Assert.assertThrows(JsonSyntaxException.class, () -> read("[1,2,3]"));
    }

    @Test
    public void readString() {
        Assert.assertEquals(BORE, read("\"12.5 +0.3/-0.2\""));
        Assert.assertEquals(Tolerance128.ZERO, read("\"\""));
        Assert.assertEquals(Tolerance128.ZERO, read("\"   \""));
        Assert.assertEquals(Tolerance64.ZERO, GSON.fromJson("\"\"", Tolerance64.class));

        var e = Assert.assertThrows(JsonParseException.class, () -> read("\"12.5 mm\""));
        Assert.assertNotNull(e.getCause());
    }

    @Test
    public void readNumberAndNull() {
        Assert.assertEquals(Tolerance128.fromTicks(125_000, 0, 0), read("125000"));
        Assert.assertEquals(Tolerance128.fromTicks(125_000, 0, 0), read("12.5"));
        Assert.assertNull(read("null"));
    }

    @Test
    public void readingIgnoresTheStyle() {
        for (var style : ToleranceGson.Style.values()) {
            var gson = ToleranceGson.gson(style);
            for (var other : ToleranceGson.Style.values()) {
                String json = ToleranceGson.gson(other).toJson(BORE);
                Assert.assertEquals(style + " <- " + json, BORE, gson.fromJson(json, Tolerance128.class));
            }
        }
    }

    @Test
    public void everyStyleReadsBackExactly() {
        var tiny = Tolerance128.fromTicks(3, 7, -3);
        var extremes = Tolerance128.fromTicks(Long.MIN_VALUE, Integer.MAX_VALUE, Integer.MIN_VALUE);
        var rnd = new Random();
        for (var style : ToleranceGson.Style.values()) {
            var gson = ToleranceGson.gson(style);
            Assert.assertEquals(style.name(), tiny, gson.fromJson(gson.toJson(tiny), Tolerance128.class));
            Assert.assertEquals(style.name(), extremes, gson.fromJson(gson.toJson(extremes), Tolerance128.class));
            for (int i = 0; i < 1_000; i++) {
                int a = rnd.nextInt();
                int b = rnd.nextInt();
                var t128 = Tolerance128.fromTicks(rnd.nextLong(), Math.max(a, b), Math.min(a, b));
                Assert.assertEquals(style + " " + t128.toAlternateString(), t128, gson.fromJson(gson.toJson(t128), Tolerance128.class));

                short c = (short) rnd.nextInt();
                short d = (short) rnd.nextInt();
                var t64 = Tolerance64.fromTicks(rnd.nextInt(), Math.max(c, d), Math.min(c, d));
                Assert.assertEquals(style + " " + t64.toAlternateString(), t64, gson.fromJson(gson.toJson(t64), Tolerance64.class));
            }
        }
    }

    @Test
    public void readNested() {
        String json = "{\"name\":\"flange\",\"bore\":[12.5,0.3,-0.2],\"slot\":{\"v\":\"8\",\"p\":\"0.1\",\"m\":\"0\"},"
                + "\"holes\":[\"6 +/-0.1\",60000,null]}";
        var drawing = GSON.fromJson(json, Drawing.class);
        Assert.assertEquals("flange", drawing.name);
        Assert.assertEquals(BORE, drawing.bore);
        Assert.assertEquals(Tolerance64.of(Fixed32.fromString("8"), Fixed16.fromString("0.1"), Fixed16.ZERO), drawing.slot);
        Assert.assertEquals(3, drawing.holes.size());
        Assert.assertEquals(Tolerance128.fromString("6 +/-0.1"), drawing.holes.get(0));
        Assert.assertEquals(Tolerance128.valueOf(Fixed64.fromString("6")), drawing.holes.get(1));
        Assert.assertNull(drawing.holes.get(2));

        Type listType = new TypeToken<List<Tolerance64>>() {}.getType();
        List<Tolerance64> list = GSON.fromJson("[\"1 +/-0.1\",\"2 +0.2/-0.1\"]", listType);
        Assert.assertEquals(List.of(Tolerance64.fromString("1 +/-0.1"), Tolerance64.fromString("2 +0.2/-0.1")), list);
    }

    @Test
    public void factory() {
        var factory = ToleranceTypeAdapterFactory.create(ToleranceGson.Style.FLOAT_SEQUENCE);
        Assert.assertEquals(ToleranceGson.Style.FLOAT_SEQUENCE, factory.getStyle());
        Assert.assertEquals(ToleranceGson.Style.STRUCT, ToleranceTypeAdapterFactory.create().getStyle());
        Assert.assertNull(factory.create(GSON, TypeToken.get(String.class)));
        Assert.assertNotNull(factory.create(GSON, TypeToken.get(Tolerance64.class)));
        Assert.assertNotNull(factory.create(GSON, TypeToken.get(Fixed16.class)));
    }
}
