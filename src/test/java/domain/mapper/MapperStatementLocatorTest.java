package domain.mapper;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapperStatementLocatorTest {

    private static final String MAPPER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <mapper namespace='com.example.UserMapper'>
                <select id="findAll" resultType="User">select * from users</select>
                <select id="empty"/>
                <insert id="insertUser" useGeneratedKeys="true">
                    <selectKey keyProperty="id" order="AFTER">SELECT LAST_INSERT_ID()</selectKey>
                    insert into users(name) values (#{name})
                </insert>
              <UPDATE id="touch" timeout="10">update users set t = now()</UPDATE>
            </mapper>
            """;

    @Test
    void isMapper_andNamespace() {
        assertTrue(MapperStatementLocator.isMapper(MAPPER));
        assertEquals("com.example.UserMapper", MapperStatementLocator.namespaceOf(MAPPER));
        assertFalse(MapperStatementLocator.isMapper("<beans><bean id=\"a\"/></beans>"));
        assertEquals("", MapperStatementLocator.namespaceOf("<beans/>"));
    }

    @Test
    void locate_findsStatementsInOrder_skippingSelfClosing() {
        List<MapperStatement> sts = MapperStatementLocator.locate(MAPPER);

        assertEquals(3, sts.size());
        assertEquals("findAll", sts.get(0).getId());
        assertEquals("select", sts.get(0).getStatementType());
        assertEquals("select * from users", sts.get(0).getContent());
        assertEquals("    ", sts.get(0).getBaseIndent());

        assertEquals("insertUser", sts.get(1).getId());
        assertEquals("insert", sts.get(1).getStatementType());
        assertTrue(sts.get(1).getContent().contains("<selectKey keyProperty=\"id\" order=\"AFTER\">"));

        assertEquals("touch", sts.get(2).getId());
        assertEquals("update", sts.get(2).getStatementType());
        assertEquals("  ", sts.get(2).getBaseIndent());
    }

    @Test
    void locate_contentOffsets_pointIntoDocument() {
        for (MapperStatement st : MapperStatementLocator.locate(MAPPER)) {
            assertEquals(st.getContent(), MAPPER.substring(st.getContentStart(), st.getContentEnd()));
            assertTrue(st.getTagStart() < st.getContentStart());
        }
    }

    @Test
    void locate_allowsGreaterThanInsideAttributeValue() {
        String doc = "<mapper namespace=\"m\"><select id=\"a\" databaseId=\"x>y\">select 1</select></mapper>";
        List<MapperStatement> sts = MapperStatementLocator.locate(doc);

        assertEquals(1, sts.size());
        assertEquals("select 1", sts.get(0).getContent());
    }

    @Test
    void baseIndentAt_keepsTabs() {
        String doc = "<mapper>\n\t\t<select id=\"a\">x</select>";
        assertEquals("\t\t", MapperStatementLocator.baseIndentAt(doc, doc.indexOf("<select")));
    }
}
