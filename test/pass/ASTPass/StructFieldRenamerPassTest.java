package pass.ASTPass;

import ast.Provenance;
import ast.decl.FieldDecl;
import ast.decl.RecordDecl;
import ast.type.IntegerType;
import debuginfo.DICompositeType;
import debuginfo.DIDerivedType;
import debuginfo.DebugInfoMap;
import exception.DecompileException;
import org.junit.jupiter.api.Test;
import pass.BaseTest;
import pass.PassContext;
import pass.StopSignal;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StructFieldRenamerPassTest extends BaseTest {
    private final Map<RecordDecl, DICompositeType> debugTypes = new IdentityHashMap<>();

    private RecordDecl record(String name, String... fieldNames) {
        List<FieldDecl> fields = new ArrayList<>();
        for (String fieldName : fieldNames) {
            fields.add(ast.createField(fieldName, IntegerType.getInt()));
        }
        return ast.addRecord(name, fields);
    }

    private void describe(RecordDecl record, String... memberNames) {
        List<DIDerivedType> members = new ArrayList<>();
        for (int i = 0; i < memberNames.length; i++) {
            members.add(new DIDerivedType(memberNames[i], 32L * i));
        }
        debugTypes.put(record, new DICompositeType(record.getName(), members));
    }

    private StructFieldRenamerPass pass() {
        PassContext withDebugInfo = new PassContext(unit, Provenance.empty(),
                new DebugInfoMap(debugTypes), new StopSignal(), 0);
        return new StructFieldRenamerPass(withDebugInfo);
    }

    private static List<String> names(RecordDecl record) {
        List<String> names = new ArrayList<>();
        for (FieldDecl field : record.getFields()) {
            names.add(field.getName());
        }
        return names;
    }

    @Test
    public void testFieldsTakeDebugNames() {
        describe(record("S", "field_0", "field_4"), "len", "data");

        assertTrue(pass().run());

        assertEquals(List.of("len", "data"), names(unit.getRecord("S")));
    }

    @Test
    public void testClashingNameGetsSyntheticSuffix() {
        describe(record("S", "a", "b", "c"), "x", "x", "y");

        assertTrue(pass().run());

        assertEquals(List.of("x", "x_b", "y"), names(unit.getRecord("S")));
    }

    @Test
    public void testRepeatedClashStaysUnique() {
        // x_c is taken by the debug name of the second member
        describe(record("S", "a", "b", "c"), "x", "x_c", "x");

        assertTrue(pass().run());

        assertEquals(List.of("x", "x_c", "x_c_2"), names(unit.getRecord("S")));
    }

    @Test
    public void testAnonymousMemberKeepsSyntheticName() {
        describe(record("S", "field_0", "field_4"), "tag", "");

        assertTrue(pass().run());

        assertEquals(List.of("tag", "field_4"), names(unit.getRecord("S")));
    }

    @Test
    public void testFieldTypesAreKept() {
        List<FieldDecl> fields = List.of(
                ast.createField("field_0", IntegerType.get(8, true)),
                ast.createField("field_8", IntegerType.get(64, false)));
        describe(ast.addRecord("S", fields), "flag", "size");

        pass().run();

        List<FieldDecl> renamed = unit.getRecord("S").getFields();
        assertSame(IntegerType.get(8, true), renamed.get(0).getType());
        assertSame(IntegerType.get(64, false), renamed.get(1).getType());
    }

    @Test
    public void testCountMismatchFails() {
        describe(record("S", "a", "b", "c"), "x", "y");

        DecompileException e = assertThrows(DecompileException.class, () -> pass().run());
        assertTrue(e.getMessage().contains("S"));
    }

    @Test
    public void testRecordWithoutDebugInfoIsLeftAlone() {
        RecordDecl plain = record("T", "a", "b");
        describe(record("S", "a"), "len");

        assertTrue(pass().run());

        assertSame(plain, unit.getRecord("T"));
        assertEquals(List.of("len"), names(unit.getRecord("S")));
    }

    @Test
    public void testMatchingNamesAreNoChange() {
        RecordDecl record = record("S", "len", "data");
        describe(record, "len", "data");

        assertFalse(pass().run());
        assertSame(record, unit.getRecord("S"));
    }

    @Test
    public void testSecondRunIsQuiet() {
        describe(record("S", "a", "b", "c"), "x", "x", "y");
        StructFieldRenamerPass pass = pass();

        assertTrue(pass.run());
        assertFalse(pass.run());
        assertEquals(List.of("x", "x_b", "y"), names(unit.getRecord("S")));
    }
}
