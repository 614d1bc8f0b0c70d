package com.agentgate.core.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 词法级表名提取
 * <p>
 * 只识别 FROM / JOIN 之后的标识符（忽略大小写，去掉库名前缀与反引号，去重并保持出现顺序）。
 * 这是轻量扫描而非语法解析：别名、子查询、CTE 都不会被展开。
 * </p>
 */
public final class SqlTableExtractor {

    // 形如: FROM db.table / JOIN `db`.`table` / FROM table
    private static final Pattern TABLE_REFERENCE = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+(?:`?[\\w-]+`?\\.)?`?(\\w+)`?",
            Pattern.CASE_INSENSITIVE);

    private SqlTableExtractor() {
    }

    public static List<String> extract(String sql) {
        if (sql == null || sql.isEmpty()) {
            return List.of();
        }
        Set<String> tables = new LinkedHashSet<>();
        Matcher matcher = TABLE_REFERENCE.matcher(sql);
        while (matcher.find()) {
            tables.add(matcher.group(1));
        }
        return new ArrayList<>(tables);
    }

    /**
     * 匹配“FROM/JOIN 该表”子句的正则
     */
    static Pattern clauseNaming(String table) {
        return Pattern.compile(
                "\\b(?:FROM|JOIN)\\s+(?:`?[\\w-]+`?\\.)?`?" + Pattern.quote(table) + "`?(?!\\w)",
                Pattern.CASE_INSENSITIVE);
    }
}
