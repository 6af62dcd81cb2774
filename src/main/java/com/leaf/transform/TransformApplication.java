package com.leaf.transform;

import com.leaf.transform.core.ArtifactNaming;
import com.leaf.transform.core.TableSource;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.core.TransformationPipeline;
import com.leaf.transform.core.TransformationRegistry;
import com.leaf.transform.core.impl.DefaultTransformationPipeline;
import com.leaf.transform.core.impl.DefaultTransformationRegistry;
import com.leaf.transform.model.PipelineResult;
import com.leaf.transform.model.TimeBinConfig;
import com.leaf.transform.model.TransformRequest;
import com.leaf.transform.operators.ComputedColumnTransformation;
import com.leaf.transform.operators.GroupIdTransformation;
import com.leaf.transform.operators.TimeBinTransformation;
import com.leaf.transform.storage.ArrowArtifactWriter;
import com.leaf.transform.storage.ArrowTableSource;
import com.leaf.transform.storage.RoutingTableSource;
import com.leaf.transform.storage.SQLiteTableSource;
import com.leaf.transform.time.TimeBinPreview;
import com.leaf.transform.time.TimeBinner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 系统启动引导类。
 * 创建数据源和产物写入器、注册内置算子、组装变换管道。
 *
 * 用法：java -cp leaf-transform.jar com.leaf.transform.TransformApplication [配置文件路径]
 * 未指定配置文件时读取类路径上的 transform.properties。
 */
public class TransformApplication {

    private static final Logger log = LoggerFactory.getLogger(TransformApplication.class);

    private AppConfig config;
    private TableSource tableSource;
    private TransformationRegistry registry;
    private TransformationPipeline pipeline;
    private TimeBinner timeBinner;

    public void start(AppConfig config) {
        log.info("=== Leaf Transform ===");
        log.info("Starting with config: {}", config);
        this.config = config;

        // 1. 数据源：已写出的产物优先，其余查询SQLite
        ArrowArtifactWriter artifactWriter = new ArrowArtifactWriter(config.getOutputDir());
        tableSource = new RoutingTableSource(
                new ArrowTableSource(config.getOutputDir()),
                new SQLiteTableSource(config.getSourceDatabasePath()));

        // 2. 注册内置算子
        timeBinner = new TimeBinner();
        registry = new DefaultTransformationRegistry();
        registerBuiltinTransformations(registry);

        // 3. 组装管道
        pipeline = new DefaultTransformationPipeline(registry, tableSource, artifactWriter,
                new ArtifactNaming(config.getNamingMaxTokens()));

        log.info("=== Leaf Transform started ===");
    }

    /**
     * 运行一次变换请求
     */
    public PipelineResult run(TransformRequest request) {
        if (pipeline == null) {
            throw new IllegalStateException("Application not started");
        }
        return pipeline.run(request);
    }

    /**
     * 对源表的时间列生成分箱预览，不写出产物
     */
    public TimeBinPreview previewTimeBins(TimeBinConfig binConfig) throws TransformException {
        if (tableSource == null) {
            throw new IllegalStateException("Application not started");
        }
        return timeBinner.preview(
                tableSource.loadTable(binConfig.getSourceTable()).column(binConfig.getSourceColumn()),
                binConfig.getStrategy(),
                config.getTimeBinPreviewSampleBins());
    }

    public TransformationRegistry getRegistry() { return registry; }

    public void shutdown() {
        if (tableSource != null) {
            tableSource.close();
        }
        log.info("=== Leaf Transform shut down ===");
    }

    /**
     * 注册系统内置的三类算子
     */
    private void registerBuiltinTransformations(TransformationRegistry registry) {
        registry.register(new TimeBinTransformation(timeBinner, config.getTimeBinValidationSampleSize()));
        registry.register(new GroupIdTransformation());
        registry.register(new ComputedColumnTransformation());

        log.info("Registered {} built-in transformations.", registry.getAll().size());
    }

    /**
     * 应用入口：加载配置并完成初始化
     */
    public static void main(String[] args) {
        AppConfig config = (args.length > 0)
                ? AppConfig.load(args[0])
                : AppConfig.loadResource("transform.properties");
        TransformApplication app = new TransformApplication();
        app.start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
    }
}
