package com.tapl.codegen;

import com.tapl.codegen.backend.ChainListEmitter;
import com.tapl.codegen.backend.EmitConfig;
import com.tapl.codegen.backend.ListHeaderEmitter;
import com.tapl.codegen.backend.RuntimeSupportEmitter;
import com.tapl.codegen.backend.TypesHeaderEmitter;
import com.tapl.codegen.lowering.CompilationContext;
import com.tapl.compiler.types.Types;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TAPL 头文件生成门面。
 *
 * <p>用法：</p>
 * <pre>
 * TaplHeaderCompiler compiler = new TaplHeaderCompiler();
 * CompilationContext ctx = compiler.newCompilation(types);
 * // 语句代码生成器在降级过程中调用 ctx.getListDriver()
 * compiler.compileAndSave(ctx, buildDir);
 * </pre>
 */
public class TaplHeaderCompiler {

    private static final Logger LOG = Logger.getLogger(TaplHeaderCompiler.class.getName());

    private final CodegenConfig config;
    private final EmitConfig emitConfig;

    public TaplHeaderCompiler() {
        this(new CodegenConfig(), new EmitConfig());
    }

    public TaplHeaderCompiler(CodegenConfig config, EmitConfig emitConfig) {
        this.config = config;
        this.emitConfig = emitConfig;
    }

    public CodegenConfig getConfig() {
        return config;
    }

    /**
     * 开始一次新的编译：创建独立的上下文并解析预加载的列表元素类型。
     */
    public CompilationContext newCompilation(Types types) {
        CompilationContext ctx = new CompilationContext(types, new ChainListEmitter(emitConfig));
        for (String keyword : config.getPreloadedElementTypes()) {
            ctx.getListDriver().resolve(types.getType(keyword));
        }
        return ctx;
    }

    /**
     * 生成本次编译的全部头文件。
     *
     * @return 文件名 → 内容，顺序固定
     */
    public Map<String, String> compile(CompilationContext ctx) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(TypesHeaderEmitter.FILE_NAME, new TypesHeaderEmitter(emitConfig).emit(ctx.getTypes()));
        headers.put(RuntimeSupportEmitter.FILE_NAME, new RuntimeSupportEmitter(emitConfig).emit());
        headers.put(ListHeaderEmitter.FILE_NAME,
                new ListHeaderEmitter(emitConfig, config.getHeaderDirectory())
                        .emit(ctx.getRegistry().getInstantiations()));
        return headers;
    }

    /**
     * 生成头文件并写入 {@code outDir/<headerDirectory>/}。
     *
     * @return 头文件所在目录
     */
    public File compileAndSave(CompilationContext ctx, File outDir) throws IOException {
        File headerDir = new File(outDir, config.getHeaderDirectory());
        Files.createDirectories(headerDir.toPath());

        for (Map.Entry<String, String> entry : compile(ctx).entrySet()) {
            File headerFile = new File(headerDir, entry.getKey());
            Files.write(headerFile.toPath(), entry.getValue().getBytes(StandardCharsets.UTF_8));
            LOG.info("Generated: " + headerFile.getPath());
        }
        return headerDir;
    }
}
