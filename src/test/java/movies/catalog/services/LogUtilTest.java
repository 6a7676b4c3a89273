package movies.catalog.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LogUtilTest {

    @Test
    void testFormatKeepsCsvColumns() {
        String line = LogUtil.formatLogMessage("a,b\nc", LogUtil.DETAIL, "ContextServer", "Sweep", "Context");
        assertEquals("a;b c,2,ContextServer,Sweep,Context", line);
    }
}
