package com.williamcallahan.latexpreview;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.preview.cache.size=16",
        "app.preview.cache.ttl=PT5M"
})
class LatexPreviewApplicationTests {

    @Test
    void contextLoads() {
    }

}
