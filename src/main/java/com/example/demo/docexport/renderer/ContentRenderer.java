package com.example.demo.docexport.renderer;

import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.ExportFormat;
import com.example.demo.docexport.model.ImageLoader;

import java.util.List;

/**
 * Renders an ordered content list into one output format.
 *
 * Implementations are stateless singletons: every call allocates its own
 * buffers, so independent lists may be rendered concurrently. Per-block
 * problems degrade or skip that block and never abort the render.
 *
 * @param <T> the rendered output
 */
public interface ContentRenderer<T> {

    T render(List<ContentBlock> blocks, ImageLoader imageLoader);

    ExportFormat format();
}
