package com.example.demo.lettergen.processor;

import com.example.demo.lettergen.core.RenderContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.BodyElementType;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Removes or unwraps paragraph-delimited conditional regions in the top-level body.
 *
 * A paragraph starting with {@code {% if NAME == 'sí' %}} opens a region and one starting
 * with {@code {% endif %}} closes it. Both marker paragraphs are always deleted; the blocks
 * in between (paragraphs and tables) survive only when NAME is bound to yes.
 * Table cells are not scanned.
 *
 * Blocks are marked in a first pass and deleted afterwards, last index first.
 * An opener without a closer keeps removing until the end of the body; that case is
 * reported as a warning on the {@link RenderContext}.
 */
@Slf4j
public class ConditionalBlockEliminator {
    private final BlockScanMode mode;

    public ConditionalBlockEliminator(BlockScanMode mode) {
        this.mode = mode == null ? BlockScanMode.NESTED : mode;
    }

    public BlockScanMode getMode() {
        return mode;
    }

    /**
     * @return number of body elements deleted
     */
    public int stripBlocks(XWPFDocument doc, RenderContext context) {
        List<IBodyElement> elements = doc.getBodyElements();
        List<Integer> doomed = new ArrayList<>();
        ScanState state = mode == BlockScanMode.FLAT ? new FlatState() : new NestedState();

        for (int i = 0; i < elements.size(); i++) {
            IBodyElement element = elements.get(i);
            String text = element instanceof XWPFParagraph
                    ? PlaceholderGrammar.trim(((XWPFParagraph) element).getText())
                    : "";

            String opened = PlaceholderGrammar.openBlockName(text);
            if (opened != null) {
                boolean keep = context.getBindings().conditional(opened).isYes();
                state.open(opened, keep);
                doomed.add(i);
                continue;
            }
            if (PlaceholderGrammar.isCloseBlock(text)) {
                if (!state.close()) {
                    log.debug("Dropping endif marker at body position {} with no open block", i);
                }
                doomed.add(i);
                continue;
            }
            if (state.removing() && isDeletable(element)) {
                doomed.add(i);
            }
        }

        if (state.removing()) {
            String warning = "Conditional block '" + state.innermostName()
                    + "' is never closed; every block after it was removed";
            log.warn(warning);
            context.addWarning(warning);
        }

        for (int j = doomed.size() - 1; j >= 0; j--) {
            doc.removeBodyElement(doomed.get(j));
        }
        log.debug("Conditional block pass ({}) removed {} body elements", mode, doomed.size());
        return doomed.size();
    }

    private boolean isDeletable(IBodyElement element) {
        return element.getElementType() == BodyElementType.PARAGRAPH
                || element.getElementType() == BodyElementType.TABLE;
    }

    private interface ScanState {
        void open(String name, boolean keep);

        /**
         * @return false if nothing was open
         */
        boolean close();

        boolean removing();

        String innermostName();
    }

    /** One flag; an opener bound to yes never clears an ongoing removal. */
    private static final class FlatState implements ScanState {
        private boolean removing;
        private String lastOpened;
        private boolean open;

        @Override
        public void open(String name, boolean keep) {
            if (!keep) {
                removing = true;
            }
            lastOpened = name;
            open = true;
        }

        @Override
        public boolean close() {
            boolean wasOpen = open;
            removing = false;
            open = false;
            return wasOpen;
        }

        @Override
        public boolean removing() {
            return removing;
        }

        @Override
        public String innermostName() {
            return lastOpened;
        }
    }

    private static final class NestedState implements ScanState {
        private final Deque<Frame> frames = new ArrayDeque<>();
        private int removedFrames;

        @Override
        public void open(String name, boolean keep) {
            frames.push(new Frame(name, keep));
            if (!keep) {
                removedFrames++;
            }
        }

        @Override
        public boolean close() {
            Frame frame = frames.poll();
            if (frame == null) {
                return false;
            }
            if (!frame.keep) {
                removedFrames--;
            }
            return true;
        }

        @Override
        public boolean removing() {
            return removedFrames > 0;
        }

        @Override
        public String innermostName() {
            Frame first = frames.peek();
            return first == null ? null : first.name;
        }
    }

    private static final class Frame {
        final String name;
        final boolean keep;

        Frame(String name, boolean keep) {
            this.name = name;
            this.keep = keep;
        }
    }
}
