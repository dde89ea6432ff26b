package com.pgost.migration.ddl;

import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.model.TableName;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based rewriter for the DDL shapes an online schema change accepts:
 * <ul>
 *   <li>{@code CREATE TABLE t (...) [PARTITION BY ...]}</li>
 *   <li>{@code CREATE TABLE p PARTITION OF t ...}</li>
 *   <li>{@code ALTER TABLE [IF EXISTS] [ONLY] t ...}</li>
 *   <li>{@code CREATE [UNIQUE] INDEX [CONCURRENTLY] [name] ON [ONLY] t ...}</li>
 * </ul>
 * Every statement must target the same table. Without a CREATE TABLE for it the shadow starts
 * as {@code LIKE source INCLUDING ALL} and the remaining statements are applied on top.
 */
@Slf4j
@Component
public class RegexShadowDdlRewriter implements ShadowDdlRewriter {
    
    private static final String IDENT = "(?:\"(?:[^\"]|\"\")+\"|[A-Za-z_][A-Za-z0-9_$]*)";
    private static final String QNAME = IDENT + "(?:\\s*\\.\\s*" + IDENT + ")?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    
    private static final Pattern IDENT_PART = Pattern.compile(IDENT);
    
    private static final Pattern ALTER_TABLE = Pattern.compile(
        "^ALTER\\s+TABLE\\s+(?:IF\\s+EXISTS\\s+)?(?:ONLY\\s+)?(" + QNAME + ")(\\s.*)$", FLAGS);
    
    private static final Pattern PARTITION_OF = Pattern.compile(
        "^CREATE\\s+(?:UNLOGGED\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(" + QNAME + ")\\s+PARTITION\\s+OF\\s+(" + QNAME + ")(.*)$",
        FLAGS);
    
    private static final Pattern CREATE_TABLE = Pattern.compile(
        "^CREATE\\s+(?:UNLOGGED\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(" + QNAME + ")\\s*(\\(.*)$", FLAGS);
    
    private static final Pattern CREATE_INDEX = Pattern.compile(
        "^CREATE\\s+(UNIQUE\\s+)?INDEX\\s+(?:CONCURRENTLY\\s+)?(?:IF\\s+NOT\\s+EXISTS\\s+)?(?:(?!ON\\s)(" + IDENT + ")\\s+)?ON\\s+(?:ONLY\\s+)?(" + QNAME + ")(.*)$",
        FLAGS);
    
    private static final Pattern RENAME_TABLE = Pattern.compile("^\\s*RENAME\\s+TO\\s.*$", FLAGS);
    private static final Pattern SET_SCHEMA = Pattern.compile("^\\s*SET\\s+SCHEMA\\s.*$", FLAGS);
    
    @Override
    public ShadowDefinition rewrite(String sql, String defaultSchema, String shadowSchema) {
        if (StringUtils.isBlank(sql)) {
            throw new ValidationException("Target DDL is empty");
        }
        
        List<String> statements = SqlStatementSplitter.split(sql);
        if (statements.isEmpty()) {
            throw new ValidationException("Target DDL contains no statements");
        }
        
        List<ParsedStatement> parsed = new ArrayList<>();
        for (String statement : statements) {
            parsed.add(parse(statement, defaultSchema));
        }
        
        Set<TableName> targets = new LinkedHashSet<>();
        for (ParsedStatement statement : parsed) {
            targets.add(statement.target);
        }
        if (targets.size() != 1) {
            throw new ValidationException("Target DDL must affect exactly one table, found: " + targets);
        }
        
        TableName source = targets.iterator().next();
        TableName shadow = source.inSchema(shadowSchema);
        
        String createStatement = null;
        List<String> followUps = new ArrayList<>();
        List<TableName> partitions = new ArrayList<>();
        
        for (ParsedStatement statement : parsed) {
            if (statement.kind == Kind.CREATE_TABLE) {
                if (createStatement != null) {
                    throw new ValidationException("Target DDL creates " + source + " more than once");
                }
                createStatement = "CREATE TABLE " + shadow.qualified() + " " + statement.remainder;
                continue;
            }
            switch (statement.kind) {
                case ALTER_TABLE:
                    followUps.add("ALTER TABLE " + shadow.qualified() + statement.remainder);
                    break;
                case PARTITION_OF:
                    TableName partition = TableName.of(shadowSchema, statement.secondaryName);
                    partitions.add(partition);
                    followUps.add("CREATE TABLE " + partition.qualified() + " PARTITION OF " + shadow.qualified() + statement.remainder);
                    break;
                case CREATE_INDEX:
                    StringBuilder index = new StringBuilder("CREATE ");
                    if (statement.unique) {
                        index.append("UNIQUE ");
                    }
                    index.append("INDEX ");
                    if (statement.secondaryName != null) {
                        index.append(TableName.quote(statement.secondaryName)).append(' ');
                    }
                    index.append("ON ").append(shadow.qualified()).append(statement.remainder);
                    followUps.add(index.toString());
                    break;
                default:
                    throw new IllegalStateException("Unexpected statement kind " + statement.kind);
            }
        }
        
        boolean cloned = createStatement == null;
        if (cloned) {
            createStatement = "CREATE TABLE " + shadow.qualified() + " (LIKE " + source.qualified() + " INCLUDING ALL)";
        }
        
        log.debug("Rewrote DDL for {}: {} follow-up statement(s), cloned={}", source, followUps.size(), cloned);
        return new ShadowDefinition(source, shadow, createStatement, List.copyOf(followUps), cloned, List.copyOf(partitions));
    }
    
    private ParsedStatement parse(String statement, String defaultSchema) {
        Matcher matcher = ALTER_TABLE.matcher(statement);
        if (matcher.matches()) {
            String remainder = matcher.group(2);
            if (RENAME_TABLE.matcher(remainder).matches() || SET_SCHEMA.matcher(remainder).matches()) {
                throw new ValidationException("Renaming or moving the migrated table is not supported: " + statement);
            }
            return new ParsedStatement(Kind.ALTER_TABLE, parseTableName(matcher.group(1), defaultSchema), remainder, null, false);
        }
        
        matcher = PARTITION_OF.matcher(statement);
        if (matcher.matches()) {
            TableName child = parseTableName(matcher.group(1), defaultSchema);
            return new ParsedStatement(Kind.PARTITION_OF, parseTableName(matcher.group(2), defaultSchema),
                matcher.group(3), child.getName(), false);
        }
        
        matcher = CREATE_TABLE.matcher(statement);
        if (matcher.matches()) {
            return new ParsedStatement(Kind.CREATE_TABLE, parseTableName(matcher.group(1), defaultSchema), matcher.group(2), null, false);
        }
        
        matcher = CREATE_INDEX.matcher(statement);
        if (matcher.matches()) {
            String indexName = matcher.group(2) == null ? null : unquote(matcher.group(2));
            return new ParsedStatement(Kind.CREATE_INDEX, parseTableName(matcher.group(3), defaultSchema),
                matcher.group(4), indexName, matcher.group(1) != null);
        }
        
        throw new ValidationException("Unsupported statement in target DDL: " + StringUtils.abbreviate(statement, 120));
    }
    
    static TableName parseTableName(String qualifiedName, String defaultSchema) {
        List<String> parts = new ArrayList<>();
        Matcher matcher = IDENT_PART.matcher(qualifiedName);
        while (matcher.find()) {
            parts.add(unquote(matcher.group()));
        }
        if (parts.size() == 2) {
            return TableName.of(parts.get(0), parts.get(1));
        }
        return TableName.of(defaultSchema, parts.get(0));
    }
    
    /**
     * Quoted identifiers keep their case; unquoted ones fold to lower case.
     */
    static String unquote(String identifier) {
        if (identifier.startsWith("\"") && identifier.endsWith("\"") && identifier.length() >= 2) {
            return identifier.substring(1, identifier.length() - 1).replace("\"\"", "\"");
        }
        return identifier.toLowerCase(Locale.ROOT);
    }
    
    private enum Kind {
        CREATE_TABLE,
        PARTITION_OF,
        ALTER_TABLE,
        CREATE_INDEX
    }
    
    private static final class ParsedStatement {
        final Kind kind;
        final TableName target;
        final String remainder;
        final String secondaryName;
        final boolean unique;
        
        ParsedStatement(Kind kind, TableName target, String remainder, String secondaryName, boolean unique) {
            this.kind = kind;
            this.target = target;
            this.remainder = remainder;
            this.secondaryName = secondaryName;
            this.unique = unique;
        }
    }
}
