package com.example.pdfoutline;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PdfOutlineApplicationTests {

    @Test
    void contextLoads() {
    }
}
