package net.neoforged.lct.core;

import net.neoforged.lct.api.Logger;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.bibliography.BibliographyException;
import net.neoforged.lct.core.parser.CitationSyntaxException;
import net.neoforged.lct.core.render.RenderOptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CitationPipelineTest {
    static String library;

    @BeforeAll
    static void loadLibrary() {
        try (var in = CitationPipelineTest.class.getResourceAsStream("library.json")) {
            library = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Nested
    class Books {
        @Test
        void testLongForms() throws Exception {
            assertRendersTo("""
                    1. Book.^[[@authorBookTitleTitle2021].]

                    2. Book w/ pin.^[[@authorAnotherBookTitle2021] at 1.]

                    3. Book w/ editor.^[[@mauthorBookEditorThis2021].]

                    4. Book w/ translator.^[[@lauthorBookTranslatorThis2021].]

                    5. Multi-volume book.^[[@nauthorMultiVolumeBookThis2021].]
                    """, """
                    1. Book.^[**Book Author**, **Book Title: A Title for the Dummy Book** (4th ed. 2021) [hereinafter **Author**, **Book Title**].]

                    2. Book w/ pin.^[**Book Author**, **Another Book Title: A Title for the Dummy Book** 1 (2021) [hereinafter **Author**, **Another Book Title**].]

                    3. Book w/ editor.^[**Book Mauthor**, **Book With an Editor: This Book Has an Editor** (2d ed., Book Editor ed., 2021).]

                    4. Book w/ translator.^[**Book Lauthor**, **Book With a Translator: This Book Has a Translator** (Book Translator trans., 2021).]

                    5. Multi-volume book.^[10 **Book Nauthor**, **Multi-Volume Book: This Book Is One of Several Volumes** (2021).]
                    """);
        }
    }

    @Test
    void testChapters() throws Exception {
        assertRendersTo("""
                1. Chapter.^[[@authorBookChapterTitle2021].]

                2. Chapter w/ pincite.^[[@authorAnotherBookChapter2021] at 101.]
                """, """
                1. Chapter.^[Chapter Author, *Book Chapter Title: The Chapter of a Book*, *in* 15 **The Title of the Chapter Book** 101 (5th ed., Book Editor ed., 2021) [hereinafter Author, *Book Chapter Title*].]

                2. Chapter w/ pincite.^[Chapter Author, *Another Book Chapter Title: The Chapter of a Book*, *in* 15 **The Title of the Chapter Book** 101, 101 (5th ed., Book Editor ed., 2021) [hereinafter Author, *Another Book Chapter Title*].]
                """);
    }

    @Test
    void testArticles() throws Exception {
        assertRendersTo("""
                1. Article.^[[@authorJournalArticleTitle2021].]

                2. Article w/ pin.^[[@authorAnotherJournalArticle2021] at 1.]

                3. Two-author article.^[[@dauthorTwoAuthorJournalArticle2021].]

                4. Three-author article.^[[@gauthorThreeAuthorJournalArticle2021].]

                5. Year-as-volume article.^[[@cauthorJournalArticleYear2021].]
                """, """
                1. Article.^[Article Author, *Journal Article Title: A Journal Article*, 99 **J. J. Articles** 1000 (2021) [hereinafter Author, *Journal Article*].]

                2. Article w/ pin.^[Article Author, *Another Journal Article Title: A Journal Article*, 1 **J. Good J. Articles** 1, 1 (2021) [hereinafter Author, *Another Journal Article*].]

                3. Two-author article.^[Article Dauthor, Jr. & Article III Fauthor, *Two-Author Journal Article: This Article Has Two Authors*, 51 **J. J. Articles** 101 (2021).]

                4. Three-author article.^[Article Gauthor, Sr., Article Hauthor, Jr. & Article III Jauthor, *Three-Author Journal Article: This Article Has Three Authors*, 50 **J. J. Articles** 201 (2021).]

                5. Year-as-volume article.^[Article Cauthor, *Journal Article With a Year Volume: This Journal Uses Years as Volumes*, 2021 **The Other J. J. Articles** 501.]
                """);
    }

    @Test
    void testManuscripts() throws Exception {
        assertRendersTo("""
                1. Manuscript.^[[@kauthorManuscriptTitleNot2021].]

                2. Not-yet-forthcoming manuscript.^[[@authorNotForthcomingManuscript2021].]

                3. Not-yet-forthcoming manuscript w/ pincite.^[[@authorAnotherNotForthcoming2021] at 1.]
                """, """
                1. Manuscript.^[Manuscript Kauthor, *Manuscript Title: Not Yet a Journal Article*, 99 **U. Manuscripts L. Rev.** (forthcoming 2021), www.manuscripts.manuscript/manuscript.]

                2. Not-yet-forthcoming manuscript.^[Manuscipt Author, *Not Yet Forthcoming Manuscript: This Manuscript Is Not Yet Placed* (forthcoming 2021) [hereinafter Author, *Not Yet*].]

                3. Not-yet-forthcoming manuscript w/ pincite.^[Manuscipt Author, *Another Not Yet Forthcoming Manuscript: This Manuscript Is Not Yet Placed* (forthcoming 2021) (manuscript at 1) [hereinafter Author, *Another Not Yet*].]
                """);
    }

    @Nested
    class Cases {
        @Test
        void testLongForms() throws Exception {
            assertRendersTo("""
                    1. Case.^[[@PlaintiffDefendant1991].]

                    2. Case w/ pincite.^[[@PlaintiffDefendant1992] at 201.]
                    """, """
                    1. Case.^[Plaintiff A v. Defendant A, 100 F.3d 1 (1st Cir. 1991).]

                    2. Case w/ pincite.^[Plaintiff B v. Defendant B, 2 F.3d 200, 201 (2d Cir. 1992).]
                    """);
        }

        @Test
        void testShortForms() throws Exception {
            assertRendersTo("""
                    1. Case A.^[[@PlaintiffDefendant1993].]

                    2. Case B.^[[@PlaintiffDefendant1994].]

                    3. Case A (short form).^[[@PlaintiffDefendant1993].]

                    4. Case B (short form).^[[@PlaintiffDefendant1994].]]

                    5. Case C w/ pin.^[[@PlaintiffDefendant1995] at 555.]

                    6. Case D w/ pin.^[[@PlaintiffDefendant1996] at 6.]

                    7. Case C w/ pin (short form).^[[@PlaintiffDefendant1995] at 555.]

                    8. Case D w/ pin (short form).^[[@PlaintiffDefendant1996] at 6.]
                    """, """
                    1. Case A.^[Plaintiff C v. Defendant C, 333 F.3d 33 (3d Cir. 1993).]

                    2. Case B.^[Plaintiff D v. Defendant D, 44 F.3d 444 (4th Cir. 1994).]

                    3. Case A (short form).^[*Plaintiff C*, 333 F.3d 33.]

                    4. Case B (short form).^[*Plaintiff D*, 44 F.3d 444.]]

                    5. Case C w/ pin.^[Plaintiff E v. Defendant E, 5 F.3d 555, 555 (5th Cir. 1995).]

                    6. Case D w/ pin.^[Plaintiff F v. Defendant F, 600 F.3d 6, 6 (6th Cir. 1996).]

                    7. Case C w/ pin (short form).^[*Plaintiff E*, 5 F.3d at 555.]

                    8. Case D w/ pin (short form).^[*Plaintiff F*, 600 F.3d at 6.]
                    """);
        }

        @Test
        void testLongFormReturnsAfterLookback() throws Exception {
            assertRendersTo("""
                    1. Cases A & B.^[[@PlaintiffDefendant1998]; [@PlaintiffDefendant1999].]

                    2. Nothing.^[Nothing.]

                    3. Nothing.^[Nothing.]

                    4. Nothing.^[Nothing.]

                    5. Nothing.^[Nothing.]

                    6. Case A (short form).^[[@PlaintiffDefendant1998].]

                    7. Case B (long form).^[[@PlaintiffDefendant1999].]

                    8. Case C.^[[@PlaintiffDefendant2000].]

                    9. Case B (short form).^[[@PlaintiffDefendant1999].]
                    """, """
                    1. Cases A & B.^[Plaintiff H v. Defendant H, 888 F.3d 8 (8th Cir. 1998); Plaintiff I v. Defendant I, 9 F.3d 9 (9th Cir. 1999).]

                    2. Nothing.^[Nothing.]

                    3. Nothing.^[Nothing.]

                    4. Nothing.^[Nothing.]

                    5. Nothing.^[Nothing.]

                    6. Case A (short form).^[*Plaintiff H*, 888 F.3d 8.]

                    7. Case B (long form).^[Plaintiff I v. Defendant I, 9 F.3d 9 (9th Cir. 1999).]

                    8. Case C.^[Plaintiff J v. Defendant J, 10 F.3d 1000 (10th Cir. 2000).]

                    9. Case B (short form).^[*Plaintiff I*, 9 F.3d 9.]
                    """);
        }

        @Test
        void testShorterLookback() throws Exception {
            var output = pipeline().renderDocument("""
                    A.^[[@PlaintiffDefendant1998].] B.^[[@PlaintiffDefendant1999].] C.^[Nothing.] D.^[[@PlaintiffDefendant1998].]
                    """, library, null, new RenderOptions(0, false, 2));
            assertThat(output).isEqualTo("""
                    A.^[Plaintiff H v. Defendant H, 888 F.3d 8 (8th Cir. 1998).] B.^[Plaintiff I v. Defendant I, 9 F.3d 9 (9th Cir. 1999).] C.^[Nothing.] D.^[Plaintiff H v. Defendant H, 888 F.3d 8 (8th Cir. 1998).]
                    """);
        }
    }

    @Test
    void testSupras() throws Exception {
        assertRendersTo("""
                1. Book.^[[@authorBookTitleTitle2021].]

                2. Chapter.^[[@authorBookChapterTitle2021].]

                3. Article.^[[@authorJournalArticleTitle2021].]

                4. Manuscript.^[[@kauthorManuscriptTitleNot2021].]

                5. Book supra.^[[@authorBookTitleTitle2021].]

                6. Chapter supra.^[[@authorBookChapterTitle2021].]

                7. Article supra.^[[@authorJournalArticleTitle2021].]

                8. Manuscript supra.^[[@kauthorManuscriptTitleNot2021].]

                9. Book supra w/ pincite.^[[@authorBookTitleTitle2021] at 1.]

                10. Chapter supra w/ pincite.^[[@authorBookChapterTitle2021] at 101.]

                11. Article supra w/ pincite.^[[@authorJournalArticleTitle2021] at 1001.]

                12. Manuscript supra w/ pincite.^[[@kauthorManuscriptTitleNot2021] at 1.]
                """, """
                1. Book.^[**Book Author**, **Book Title: A Title for the Dummy Book** (4th ed. 2021) [hereinafter **Author**, **Book Title**].]

                2. Chapter.^[Chapter Author, *Book Chapter Title: The Chapter of a Book*, *in* 15 **The Title of the Chapter Book** 101 (5th ed., Book Editor ed., 2021) [hereinafter Author, *Book Chapter Title*].]

                3. Article.^[Article Author, *Journal Article Title: A Journal Article*, 99 **J. J. Articles** 1000 (2021) [hereinafter Author, *Journal Article*].]

                4. Manuscript.^[Manuscript Kauthor, *Manuscript Title: Not Yet a Journal Article*, 99 **U. Manuscripts L. Rev.** (forthcoming 2021), www.manuscripts.manuscript/manuscript.]

                5. Book supra.^[**Author**, **Book Title**, *supra* note 1.]

                6. Chapter supra.^[Author, *Book Chapter Title*, *supra* note 2.]

                7. Article supra.^[Author, *Journal Article*, *supra* note 3.]

                8. Manuscript supra.^[Kauthor, *supra* note 4.]

                9. Book supra w/ pincite.^[**Author**, **Book Title**, *supra* note 1, at 1.]

                10. Chapter supra w/ pincite.^[Author, *Book Chapter Title*, *supra* note 2, at 101.]

                11. Article supra w/ pincite.^[Author, *Journal Article*, *supra* note 3, at 1001.]

                12. Manuscript supra w/ pincite.^[Kauthor, *supra* note 4, at 1.]
                """);
    }

    @Nested
    class Ids {
        @Test
        void testBareId() throws Exception {
            assertRendersTo("""
                    1. Case A.^[[@PlaintiffDefendant2000].]

                    2. Case A (*Id.*).^[[@PlaintiffDefendant2000].]

                    3. Article A.^[[@cauthorJournalArticleYear2021].]

                    4. Article A (*Id.*).^[[@cauthorJournalArticleYear2021].]
                    """, """
                    1. Case A.^[Plaintiff J v. Defendant J, 10 F.3d 1000 (10th Cir. 2000).]

                    2. Case A (*Id.*).^[*Id.*]

                    3. Article A.^[Article Cauthor, *Journal Article With a Year Volume: This Journal Uses Years as Volumes*, 2021 **The Other J. J. Articles** 501.]

                    4. Article A (*Id.*).^[*Id.*]
                    """);
        }

        @Test
        void testIdWithPincite() throws Exception {
            assertRendersTo("""
                    1. Case B w/ pin.^[[@PlaintiffDefendant2001] at 12.]

                    2. Case B w/ pin (*Id.* at).^[[@PlaintiffDefendant2001] at 13.]

                    3. Case B w/ same pin (*Id.*).^[[@PlaintiffDefendant2001] at 13.]
                    """, """
                    1. Case B w/ pin.^[Plaintiff K v. Defendant K, 111 F.3d 1111, 12 (11th Cir. 2001).]

                    2. Case B w/ pin (*Id.* at).^[*Id.* at 13.]

                    3. Case B w/ same pin (*Id.*).^[*Id.*]
                    """);
        }

        @Test
        void testSameSourceTwiceInOneFootnote() throws Exception {
            assertRendersTo("""
                    1. Case C twice.^[Text. [@PlaintiffDefendant1991] at 10. Text. [@PlaintiffDefendant1991] at 12.]
                    """, """
                    1. Case C twice.^[Text. Plaintiff A v. Defendant A, 100 F.3d 1, 10 (1st Cir. 1991). Text. *Id.* at 12.]
                    """);
        }

        @Test
        void testIdInStringCite() throws Exception {
            assertRendersTo("""
                    1. Article A.^[[@cauthorJournalArticleYear2021] at 501.]

                    2. Articles A & B.^[[@cauthorJournalArticleYear2021] at 501; [@dauthorTwoAuthorJournalArticle2021] at 110.]

                    3. Article B.^[[@dauthorTwoAuthorJournalArticle2021] at 111.]
                    """, """
                    1. Article A.^[Article Cauthor, *Journal Article With a Year Volume: This Journal Uses Years as Volumes*, 2021 **The Other J. J. Articles** 501, 501.]

                    2. Articles A & B.^[*Id.*; Article Dauthor, Jr. & Article III Fauthor, *Two-Author Journal Article: This Article Has Two Authors*, 51 **J. J. Articles** 101, 110 (2021).]

                    3. Article B.^[Dauthor & Fauthor, *supra* note 2, at 111.]
                    """);
        }

        @Test
        void testCapitalizationFollowsPunctuation() throws Exception {
            assertRendersTo("""
                    1. None.^[[@PlaintiffDefendant2000] at 1001.]

                    2. Period.^[Period. [@PlaintiffDefendant2000] at 1002.]

                    3. Comma.^[Comma, [@PlaintiffDefendant2000] at 1003.]

                    4. Semicolon.^[Semicolon; [@PlaintiffDefendant2000] at 1004.]

                    5. Colon.^[Colon: [@PlaintiffDefendant2000] at 1005.]

                    6. Exclamation point.^[Exclamation point! [@PlaintiffDefendant2000] at 1006.]

                    7. Question mark.^[Question mark? [@PlaintiffDefendant2000] at 1007.]
                    """, """
                    1. None.^[Plaintiff J v. Defendant J, 10 F.3d 1000, 1001 (10th Cir. 2000).]

                    2. Period.^[Period. *Id.* at 1002.]

                    3. Comma.^[Comma, *id.* at 1003.]

                    4. Semicolon.^[Semicolon; *id.* at 1004.]

                    5. Colon.^[Colon: *id.* at 1005.]

                    6. Exclamation point.^[Exclamation point! *Id.* at 1006.]

                    7. Question mark.^[Question mark? *Id.* at 1007.]
                    """);
        }

        @Test
        void testNoIdAfterStringCite() throws Exception {
            assertRendersTo("""
                    1. This footnote has a string cite.^[*See, e.g.*, [@PlaintiffDefendant1998] at 12; [@dauthorTwoAuthorJournalArticle2021] at 110.]
                    2. This footnote should have a short cite.^[*Cf.* [@dauthorTwoAuthorJournalArticle2021] at 112.]
                    """, """
                    1. This footnote has a string cite.^[*See, e.g.*, Plaintiff H v. Defendant H, 888 F.3d 8, 12 (8th Cir. 1998); Article Dauthor, Jr. & Article III Fauthor, *Two-Author Journal Article: This Article Has Two Authors*, 51 **J. J. Articles** 101, 110 (2021).]
                    2. This footnote should have a short cite.^[*Cf.* Dauthor & Fauthor, *supra* note 1, at 112.]
                    """);
        }

        @Test
        void testCiteBreakPreventsId() throws Exception {
            assertRendersTo("""
                    1. Case A.^[[@PlaintiffDefendant1998].]

                    2. Breaker.^[[$] A different source.]

                    3. Case A.^[[@PlaintiffDefendant1998].]
                    """, """
                    1. Case A.^[Plaintiff H v. Defendant H, 888 F.3d 8 (8th Cir. 1998).]

                    2. Breaker.^[A different source.]

                    3. Case A.^[*Plaintiff H*, 888 F.3d 8.]
                    """);
        }

        @Test
        void testParentheticalKeepsPunctuation() throws Exception {
            assertRendersTo("""
                    A.^[[@PlaintiffDefendant2000].] B.^[[@PlaintiffDefendant2000] (holding that ids work).]
                    """, """
                    A.^[Plaintiff J v. Defendant J, 10 F.3d 1000 (10th Cir. 2000).] B.^[*Id.* (holding that ids work).]
                    """);
        }

        @Test
        void testClauseEndsWithFootnote() throws Exception {
            assertRendersTo("""
                    1. Comma, then text.^[Text [@PlaintiffDefendant2000] at 5, and more text]

                    2. Case A.^[[@PlaintiffDefendant1991] at 3.]

                    3. Case A again.^[[@PlaintiffDefendant1991] at 3.]
                    """, """
                    1. Comma, then text.^[Text Plaintiff J v. Defendant J, 10 F.3d 1000, 5 (10th Cir. 2000), and more text]

                    2. Case A.^[Plaintiff A v. Defendant A, 100 F.3d 1, 3 (1st Cir. 1991).]

                    3. Case A again.^[*Id.*]
                    """);
        }

        @Test
        void testClauseEndsWithSentenceInText() throws Exception {
            assertRendersTo("""
                    1. Two sentences.^[[@cauthorJournalArticleYear2021] at 5; text. More [@dauthorTwoAuthorJournalArticle2021] at 3.]

                    2. Article B.^[[@dauthorTwoAuthorJournalArticle2021] at 3.]
                    """, """
                    1. Two sentences.^[Article Cauthor, *Journal Article With a Year Volume: This Journal Uses Years as Volumes*, 2021 **The Other J. J. Articles** 501, 5; text. More Article Dauthor, Jr. & Article III Fauthor, *Two-Author Journal Article: This Article Has Two Authors*, 51 **J. J. Articles** 101, 3 (2021).]

                    2. Article B.^[*Id.*]
                    """);
        }

        @Test
        void testClauseEndsWithSentencePunctuationBeforeCitation() throws Exception {
            assertRendersTo("""
                    1. Two sentences.^[[@cauthorJournalArticleYear2021] at 5, text. [@dauthorTwoAuthorJournalArticle2021] at 3.]

                    2. Article B.^[[@dauthorTwoAuthorJournalArticle2021] at 4.]
                    """, """
                    1. Two sentences.^[Article Cauthor, *Journal Article With a Year Volume: This Journal Uses Years as Volumes*, 2021 **The Other J. J. Articles** 501, 5, text. Article Dauthor, Jr. & Article III Fauthor, *Two-Author Journal Article: This Article Has Two Authors*, 51 **J. J. Articles** 101, 3 (2021).]

                    2. Article B.^[*Id.* at 4.]
                    """);
        }

        @Test
        void testUnknownSourceThenCiteBreakPreventsId() throws Exception {
            assertRendersTo("""
                    1. Case A.^[[@PlaintiffDefendant2000] at 5.]

                    2. Unknown, then Case A.^[[@noSuchSource2020] at 4; [$] [@PlaintiffDefendant2000] at 5.]
                    """, """
                    1. Case A.^[Plaintiff J v. Defendant J, 10 F.3d 1000, 5 (10th Cir. 2000).]

                    2. Unknown, then Case A.^[[@noSuchSource2020] at 4; *Plaintiff J*, 10 F.3d at 5.]
                    """);
        }
    }

    @Nested
    class Signals {
        @Test
        void testItalicSignals() throws Exception {
            assertRendersTo("""
                    1. No signal.^[[@PlaintiffDefendant2000] at 1001.]

                    2. `*E.g.*` signal.^[*E.g.* [@PlaintiffDefendant2000] at 1002.]
                    3. `*e.g.*` signal.^[[@PlaintiffDefendant2000] at 1003; *e.g.* [@PlaintiffDefendant2000] at 1004.]
                    4. 'e.g.' signal.^[Lead in, e.g. [@PlaintiffDefendant2000] at 1005.]

                    5. `*See, e.g.*,` signal.^[*See, e.g.*, [@PlaintiffDefendant2000] at 1002.]
                    6. `*see, e.g.*,` signal.^[[@PlaintiffDefendant2000] at 1003; *see, e.g.*, [@PlaintiffDefendant2000] at 1004.]
                    7. `see, e.g.,` signal.^[Lead in, see, e.g., [@PlaintiffDefendant2000] at 1005.]

                    8. `*But cf., e.g.*,` signal.^[*But cf., e.g.*, [@PlaintiffDefendant2000] at 1002.]
                    9. `*but cf., e.g.*,` signal.^[[@PlaintiffDefendant2000] at 1003; *but cf., e.g.*, [@PlaintiffDefendant2000] at 1004.]
                    10. `but cf., e.g.,` signal.^[Lead in, but cf., e.g., [@PlaintiffDefendant2000] at 1005.]

                    11. `*See generally*` signal.^[*See generally* [@PlaintiffDefendant2000] at 1002.]
                    12. `see generally` signal.^[Lead in, see generally [@PlaintiffDefendant2000] at 1005.]
                    """, """
                    1. No signal.^[Plaintiff J v. Defendant J, 10 F.3d 1000, 1001 (10th Cir. 2000).]

                    2. `*E.g.*` signal.^[*E.g.* *id.* at 1002.]
                    3. `*e.g.*` signal.^[*Id.* at 1003; *e.g.* *id.* at 1004.]
                    4. 'e.g.' signal.^[Lead in, e.g. *id.* at 1005.]

                    5. `*See, e.g.*,` signal.^[*See, e.g.*, *id.* at 1002.]
                    6. `*see, e.g.*,` signal.^[*Id.* at 1003; *see, e.g.*, *id.* at 1004.]
                    7. `see, e.g.,` signal.^[Lead in, see, e.g., *id.* at 1005.]

                    8. `*But cf., e.g.*,` signal.^[*But cf., e.g.*, *id.* at 1002.]
                    9. `*but cf., e.g.*,` signal.^[*Id.* at 1003; *but cf., e.g.*, *id.* at 1004.]
                    10. `but cf., e.g.,` signal.^[Lead in, but cf., e.g., *id.* at 1005.]

                    11. `*See generally*` signal.^[*See generally* *id.* at 1002.]
                    12. `see generally` signal.^[Lead in, see generally *id.* at 1005.]
                    """);
        }

        @Test
        void testCompareWith() throws Exception {
            assertRendersTo("""
                    1. Start.^[[@PlaintiffDefendant2000] at 1001.]
                    2. `*Compare*` signal.^[*Compare* [@PlaintiffDefendant2000] at 1002, *with* [@PlaintiffDefendant2000] at 1002.]
                    """, """
                    1. Start.^[Plaintiff J v. Defendant J, 10 F.3d 1000, 1001 (10th Cir. 2000).]
                    2. `*Compare*` signal.^[*Compare* *id.* at 1002, *with* *id.*]
                    """);
        }

        @Test
        void testSignalWithoutCitationIsText() throws Exception {
            assertRendersTo("""
                    1. Signal without a cite.^[See the discussion in Part II.]
                    """, """
                    1. Signal without a cite.^[See the discussion in Part II.]
                    """);
        }
    }

    @Nested
    class CrossReferences {
        @Test
        void testCrossReferences() throws Exception {
            assertRendersTo("""
                    1. This sentence's footnote has an ID.^[[?first] Footnote contents.]
                    2. This sentence refers back to the first footnote.^[[?second] *See* *supra* note [?first].]
                    3. This sentence refers to the next note.^[[?third] *But see* *infra* note [?fourth] and accompanying text.]

                    4. This sentence refers back to the first two.^[[?fourth] *E.g.*, text accompanying *supra* notes [?first] & [?second].]
                    5. And this sentence refers to the middle three.^[[?fifth] *Contra* *supra* notes [?second]--[?fourth].]
                    """, """
                    1. This sentence's footnote has an ID.^[Footnote contents.]
                    2. This sentence refers back to the first footnote.^[*See* *supra* note 1.]
                    3. This sentence refers to the next note.^[*But see* *infra* note 4 and accompanying text.]

                    4. This sentence refers back to the first two.^[*E.g.*, text accompanying *supra* notes 1 & 2.]
                    5. And this sentence refers to the middle three.^[*Contra* *supra* notes 2--4.]
                    """);
        }

        @Test
        void testUnresolvedCrossReferenceIsKept() throws Exception {
            assertRendersTo(
                    "Invalid cross-reference.^[*See* *infra* note [?non_existent] and accompanying text.]",
                    "Invalid cross-reference.^[*See* *infra* note [?non_existent] and accompanying text.]"
            );
        }

        @Test
        void testOffsetShiftsCrossReferences() throws Exception {
            var output = pipeline().renderDocument(
                    "A.^[[?a] Text.] B.^[*See* *supra* note [?a].]",
                    library, null, 10, false);
            assertThat(output).isEqualTo("A.^[Text.] B.^[*See* *supra* note 11.]");
        }
    }

    @Test
    void testOffsetAppliesToSupraNotes() throws Exception {
        var output = pipeline().renderDocument(
                "A.^[[@authorJournalArticleTitle2021].] B.^[[@PlaintiffDefendant2000].] C.^[[@authorJournalArticleTitle2021] at 1001.]",
                library, null, 3, false);
        assertThat(output).endsWith("C.^[Author, *supra* note 4, at 1001.]");
    }

    @Test
    void testRenderedDocumentIsUnchangedWhenRenderedAgain() throws Exception {
        var input = """
                1. Book.^[[@authorBookTitleTitle2021].]

                2. Book again.^[[@authorBookTitleTitle2021] at 7.]

                3. Article.^[*See* [@authorJournalArticleTitle2021] at 1001 (explaining); [$] text.]

                4. Case.^[[@PlaintiffDefendant2000]; [@PlaintiffDefendant2001] at 12.]
                """;
        var rendered = pipeline().renderDocument(input, library, null, 0, false);

        assertThat(rendered).doesNotContain("[@", "[$]");
        assertThat(pipeline().renderDocument(rendered, library, null, 0, false)).isEqualTo(rendered);
    }

    @Test
    void testSmallCaps() throws Exception {
        var output = pipeline().renderDocument("Book.^[[@lauthorBookTranslatorThis2021].]", library, null, 0, true);
        assertThat(output).isEqualTo("Book.^[[Book Lauthor]{custom-style=\"True Small Caps\"}, "
                                     + "[Book With a Translator: This Book Has a Translator]{custom-style=\"True Small Caps\"} "
                                     + "(Book Translator trans., 2021).]");
    }

    @Test
    void testUserJournalsOverrideSynthesizedAbbreviation() throws Exception {
        var output = pipeline().renderDocument(
                "Article.^[[@gauthorThreeAuthorJournalArticle2021].]",
                library,
                "{\"Journal of Journal Articles\": \"Jour. Jour. Art.\"}",
                0, false);
        assertThat(output).contains("50 **Jour. Jour. Art.** 201 (2021)");
    }

    @Test
    void testUnknownReferenceIsLeftAsWritten() throws Exception {
        assertRendersTo(
                "Missing.^[*See* [@noSuchSource2020] at 5 (explaining nothing).]",
                "Missing.^[*See* [@noSuchSource2020] at 5 (explaining nothing).]"
        );
    }

    @Test
    void testTextOutsideFootnotesIsUnchanged() throws Exception {
        var markdown = """
                # Heading

                Some *text* with [a link](https://example.com) and [@notACitation] outside of a footnote.
                """;
        assertRendersTo(markdown, markdown);
    }

    @Test
    void testSyntaxErrorFailsTheRun() {
        assertThatThrownBy(() -> pipeline().renderDocument("Text.^[Unclosed footnote.", library, null, 0, false))
                .isInstanceOf(CitationSyntaxException.class)
                .hasMessageContaining("open footnote");
    }

    @Test
    void testMalformedLibraryFailsTheRun() {
        assertThatThrownBy(() -> pipeline().renderDocument("Text.", "[{\"id\": ", null, 0, false))
                .isInstanceOf(BibliographyException.class)
                .hasMessageStartingWith("Error deserializing the CSL JSON library");
    }

    private static CitationPipeline pipeline() {
        return new CitationPipeline(new TransformContext(Logger.SILENT));
    }

    private static void assertRendersTo(String input, String expected) throws CitationException {
        assertThat(pipeline().renderDocument(input, library, null, 0, false)).isEqualTo(expected);
    }
}
