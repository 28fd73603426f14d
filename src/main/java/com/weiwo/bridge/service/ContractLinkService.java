package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.ContractLink;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.FileScanException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 合同附件关联任务
 *
 * <p>ERP 上传的附件在磁盘上以流水号命名，真实文件名只出现在合同正文的链接文字中。
 * 本任务读取各数据库导出的 contract.csv（制表符分隔：序号、标题、正文 HTML），
 * 把链接文字回写为台账中的 filename，并记录合同标题与序号。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractLinkService {

    public static final String SCRIPT_NAME = "contract_link";

    static final String UPLOAD_PATH_MARKER = "/sysa/edit/upimages/";

    private static final Pattern A_TAG = Pattern.compile("<a\\s+([^>]+)>(.*?)</a>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"']+)[\"']",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");

    /** bcp 导出可能是 UTF-8，也可能是本地代码页或 UTF-16 */
    private static final List<Charset> CANDIDATE_CHARSETS = List.of(
            StandardCharsets.UTF_8, Charset.forName("GBK"), StandardCharsets.UTF_16);

    private final ApplicationProperties applicationProperties;
    private final LedgerStore ledgerStore;
    private final StageExecutor stageExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Mono<ScriptProcessRecord> link() {
        return stageExecutor.execute(SCRIPT_NAME, running, this::linkAll);
    }

    private Mono<Void> linkAll(StageRun run) {
        ApplicationProperties.Contract contractConfig = applicationProperties.getContract();
        return Mono.fromCallable(() -> readDumpDirectory(Path.of(contractConfig.getDumpDir()), contractConfig.getFileName()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .concatMap(link -> apply(run, link))
                .then();
    }

    /**
     * 读取导出目录下每个数据库子目录的合同文件
     */
    List<ContractLink> readDumpDirectory(Path dumpDir, String fileName) throws IOException {
        if (!Files.isDirectory(dumpDir)) {
            throw new FileScanException(dumpDir.toString(), "合同导出目录不存在");
        }
        List<Path> databaseDirs;
        try (Stream<Path> entries = Files.list(dumpDir)) {
            databaseDirs = entries.filter(Files::isDirectory).sorted().toList();
        }

        List<ContractLink> links = new ArrayList<>();
        for (Path databaseDir : databaseDirs) {
            Path contractFile = databaseDir.resolve(fileName);
            if (!Files.isRegularFile(contractFile)) {
                log.warn("未找到合同文件: {}", contractFile);
                continue;
            }
            String text = decode(Files.readAllBytes(contractFile));
            if (text == null) {
                log.error("合同文件编码无法识别，跳过: {}", contractFile);
                continue;
            }
            List<ContractLink> parsed = parseContractFile(databaseDir.getFileName().toString(), text);
            log.info("解析合同文件: {} 附件链接数={}", contractFile, parsed.size());
            links.addAll(parsed);
        }
        return links;
    }

    private Mono<Void> apply(StageRun run, ContractLink link) {
        run.processed();
        String physicalName = physicalFilename(link.href());
        String suffix = relativeSuffix(link.href());
        if (physicalName.isEmpty() || suffix.isEmpty()) {
            return Mono.empty();
        }

        return ledgerStore.findByFilenameSuffix(physicalName)
                .filter(record -> normalize(record.getFilepath()).endsWith(suffix))
                .next()
                .flatMap(record -> update(run, record, link))
                .then();
    }

    private Mono<Boolean> update(StageRun run, DocumentRecord record, ContractLink link) {
        if (link.displayName().equals(record.getFilename())) {
            return Mono.just(false);
        }
        return ledgerStore.linkContract(record.getId(), link.displayName(), link.contractTitle(),
                        link.contractOrd(), link.databaseName())
                .doOnNext(applied -> {
                    if (applied) {
                        run.updated();
                        log.info("关联合同附件: {} {} -> {} (合同: {}, 序号: {})", record.getFilepath(),
                                record.getFilename(), link.displayName(), link.contractTitle(), link.contractOrd());
                    }
                });
    }

    /**
     * 依次尝试候选编码，返回第一个能无损解码的结果
     */
    static String decode(byte[] bytes) {
        for (Charset charset : CANDIDATE_CHARSETS) {
            try {
                return charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("合同文件不是 {} 编码", charset.name());
            }
        }
        return null;
    }

    static List<ContractLink> parseContractFile(String databaseName, String text) {
        List<ContractLink> links = new ArrayList<>();
        for (String rawLine : text.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\t", -1);
            if (parts.length < 3) {
                continue;
            }
            int ord;
            try {
                ord = Integer.parseInt(parts[0].strip());
            } catch (NumberFormatException e) {
                log.warn("合同序号无效，跳过该行: {}", parts[0]);
                continue;
            }
            String title = parts[1].strip();
            String content = String.join("\t", Arrays.asList(parts).subList(2, parts.length));
            for (String[] anchor : parseAnchors(content)) {
                links.add(new ContractLink(databaseName, ord, title, anchor[0], anchor[1]));
            }
        }
        return links;
    }

    /**
     * 提取正文中指向上传目录的链接，返回 [href, 显示名称]；WebSource.ashx 等其他链接忽略
     */
    static List<String[]> parseAnchors(String content) {
        List<String[]> anchors = new ArrayList<>();
        Matcher matcher = A_TAG.matcher(content);
        while (matcher.find()) {
            Matcher href = HREF.matcher(matcher.group(1));
            if (!href.find()) {
                continue;
            }
            String url = href.group(1);
            if (!normalize(url).contains(UPLOAD_PATH_MARKER)) {
                continue;
            }
            String displayName = HTML_TAG.matcher(matcher.group(2)).replaceAll("").strip();
            if (!displayName.isEmpty()) {
                anchors.add(new String[]{url, displayName});
            }
        }
        return anchors;
    }

    static String physicalFilename(String href) {
        String normalized = href.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * 从上传目录标记开始的相对路径（小写、正斜杠、无前导斜杠），用于与磁盘绝对路径做后缀比对
     */
    static String relativeSuffix(String href) {
        String normalized = normalize(href);
        int marker = normalized.indexOf(UPLOAD_PATH_MARKER);
        String relative = marker >= 0 ? normalized.substring(marker) : normalized;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return relative;
    }

    static String normalize(String path) {
        return path.replace('\\', '/').toLowerCase(Locale.ROOT);
    }
}
