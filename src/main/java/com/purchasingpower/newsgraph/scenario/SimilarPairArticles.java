package com.purchasingpower.newsgraph.scenario;

import com.purchasingpower.newsgraph.model.Article;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Two Ukrainian write-ups of the WAN 2.5 release posted five minutes apart, used to seed the duplicate
 * detector with a realistic near-duplicate pair.
 */
public final class SimilarPairArticles {

    private static final List<String> TOPICS = List.of(
            "WAN 2.5", "Multimodal Models", "Video Generation", "Image Editing");

    private SimilarPairArticles() {
    }

    public static List<Article> create(Clock clock) {
        Instant now = clock.instant();
        Article draft = Article.builder()
                .messageId("1719")
                .title("WAN 2.5 — український драфт під відео")
                .body("""
                        Ось український драфт для підпису до цього відео:

                        WAN 2.5: переклад списку нових фішок ламає очі — від англійської до квазі-англійської. \
                        Виокремлю ключові моменти.

                        Мультимодальність: підтримка тексту, зображень, відео та аудіо на вході й виході.
                        Ліпсінк для кількох персонажів у кадрі.
                        Покращене розуміння промптів та вхідних даних завдяки мультимодальному тренуванню.
                        1080p HD, 10 секунд.
                        Генерація та редагування зображень.

                        • Архітектурні особливості: Нативна мультимодальність, глибока алігнація
                        ∘ Нативна мультимодальна архітектура: Новий уніфікований фреймворк для розуміння та \
                        генерації, гнучко підтримує вхід/вихід тексту, зображень, відео та аудіо.
                        ∘ Спільне мультимодальне тренування: Покращена алігнація модальностей завдяки спільному \
                        тренуванню на текстових, аудіо- та візуальних даних.
                        ∘ Алігнація з людськими уподобаннями: Використовує RLHF для постійної адаптації до \
                        людських переваг, покращуючи якість зображень та динаміку відео.

                        • Можливості відео: Аудіовізуальна синхронізація, кінематографічна якість
                        ∘ Синхронізована генерація А/В: Нативно підтримує генерацію відео з синхронізованим \
                        аудіо, включаючи вокал кількох осіб, звукові ефекти та BGM.
                        ∘ Кінематографічна естетика: генерує 1080p HD відео тривалістю 10 с кінематографічної якості.

                        • Можливості зображень: Креативний та точний контроль
                        ∘ Редагування зображень: Підтримує розмовне, інструкційне редагування з піксельною \
                        точністю для завдань на кшталт злиття концептів, трансформації матеріалів, зміни \
                        кольорів продуктів тощо.

                        Деталі: https://wan.video/

                        #dubovykai
                        """)
                .url("https://t.me/dubovykai/1719")
                .publishedAt(now.minus(Duration.ofMinutes(5)))
                .sourceChannel("dubovykai")
                .topics(TOPICS)
                .build();

        Article digest = Article.builder()
                .messageId("1720")
                .title("WAN 2.5: мультимодальна збірка в деталях")
                .body("""
                        WAN 2.5 отримав україномовний опис для релізного відео, тож зібрав головні тези у більш \
                        розмовному стилі.

                        Ключові апдейти:
                        • справжня мультимодальність: один стек для текстових, візуальних та аудіо ввід/вивід;
                        • синхронний ліпсінк навіть для кількох персонажів в кадрі;
                        • тренування одразу на тексті, зображеннях та звуку, завдяки чому модель краще тримає \
                        промпт і структуру сцени;
                        • рідний 1080p / 10 секунд із контрольованою камерою;
                        • редактор і генератор картинок у тому ж пайплайні.

                        Архітектура та тренування:
                        - уніфікований мультимодальний фреймворк без костилів;
                        - спільна оптимізація модальностей + RLHF, щоб збільшити якість відео та стабільність \
                        анімацій.

                        Модуль зображень: покращений текст-ту-імідж і точкові редакції, зміна кольорів \
                        продукту, злиття концептів чи типографіка у брендових стилях.

                        Детальніше: https://wan.video/

                        #dubovykai
                        """)
                .url("https://t.me/dubovykai/1720")
                .publishedAt(now)
                .sourceChannel("dubovykai")
                .topics(TOPICS)
                .build();

        return List.of(draft, digest);
    }
}
